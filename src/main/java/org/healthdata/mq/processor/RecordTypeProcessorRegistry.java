package org.healthdata.mq.processor;

import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.exception.UnsupportedRecordTypeException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 按记录类型分发的处理器注册表
 * - 收集容器中全部 RecordTypeProcessor，按小写记录类型索引
 * - 同一类型注册两次时启动失败
 * - 未注册的类型抛出 UnsupportedRecordTypeException，由消费者按处理失败走重试
 */
@Slf4j
@Component
public class RecordTypeProcessorRegistry implements MessageProcessor {

    private final Map<String, RecordTypeProcessor> processors;

    public RecordTypeProcessorRegistry(List<RecordTypeProcessor> processors) {
        Map<String, RecordTypeProcessor> byType = new LinkedHashMap<>();
        for (RecordTypeProcessor processor : processors) {
            String type = normalize(processor.recordType());
            RecordTypeProcessor existing = byType.putIfAbsent(type, processor);
            if (existing != null) {
                throw new IllegalStateException("记录类型重复注册: " + type + ", "
                        + existing.getClass().getSimpleName() + " / " + processor.getClass().getSimpleName());
            }
        }
        this.processors = Collections.unmodifiableMap(byType);
        log.info("[处理器注册完成] recordTypes={}", this.processors.keySet());
    }

    @Override
    public boolean process(HealthDataMessage message) throws Exception {
        RecordTypeProcessor processor = processors.get(normalize(message.getRecordType()));
        if (processor == null) {
            throw new UnsupportedRecordTypeException(message.getRecordType());
        }
        log.debug("[分发处理器] messageId={}, recordType={}, processor={}",
                message.getMessageId(), message.getRecordType(), processor.getClass().getSimpleName());
        return processor.process(message);
    }

    public boolean supports(String recordType) {
        return recordType != null && processors.containsKey(normalize(recordType));
    }

    public Set<String> recordTypes() {
        return processors.keySet();
    }

    private static String normalize(String recordType) {
        if (recordType == null || recordType.isBlank()) {
            throw new IllegalArgumentException("recordType 不能为空");
        }
        return recordType.trim().toLowerCase(Locale.ROOT);
    }
}
