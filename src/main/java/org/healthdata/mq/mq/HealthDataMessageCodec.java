package org.healthdata.mq.mq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.exception.MalformedMessageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 消息编解码
 * - JSON（snake_case字段），serialize/deserialize 可逆
 * - 解析失败或缺少必填字段统一抛出 MalformedMessageException
 */
@Component
public class HealthDataMessageCodec {

    private final ObjectMapper objectMapper;

    public HealthDataMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] serialize(HealthDataMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            // 所有字段都是简单类型，只有healthMetadata里放了不可序列化的对象才会走到这里
            throw new IllegalArgumentException("消息序列化失败: messageId=" + message.getMessageId(), e);
        }
    }

    public String serializeToString(HealthDataMessage message) {
        return new String(serialize(message), StandardCharsets.UTF_8);
    }

    public HealthDataMessage deserialize(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedMessageException("消息体为空", null);
        }
        try {
            HealthDataMessage message = objectMapper.readValue(body, HealthDataMessage.class);
            if (message == null) {
                throw new MalformedMessageException("消息体为JSON null", null);
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("消息解析失败: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMessageException("消息读取失败: " + e.getMessage(), e);
        }
    }

    public HealthDataMessage deserialize(String json) {
        return deserialize(json != null ? json.getBytes(StandardCharsets.UTF_8) : null);
    }
}
