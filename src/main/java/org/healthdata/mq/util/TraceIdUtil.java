package org.healthdata.mq.util;

import org.healthdata.mq.domain.HealthDataMessage;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * 全链路追踪工具类
 * - HTTP请求：traceId
 * - MQ消息：messageId、correlationId、idempotencyKey
 * - 全部放入MDC，由日志pattern输出；调用方在finally中清除
 */
public final class TraceIdUtil {

    public static final String TRACE_ID = "traceId";
    public static final String MESSAGE_ID = "messageId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String IDEMPOTENCY_KEY = "idempotencyKey";

    private TraceIdUtil() {
    }

    /**
     * 生成新的追踪ID
     */
    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        MDC.put(TRACE_ID, traceId);
    }

    /**
     * 获取当前的追踪ID，未设置时返回 null
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    public static void clearTraceId() {
        MDC.remove(TRACE_ID);
    }

    /**
     * 绑定一次投递的追踪上下文，traceId 复用 correlationId
     */
    public static void bind(HealthDataMessage message) {
        MDC.put(MESSAGE_ID, message.getMessageId());
        MDC.put(CORRELATION_ID, message.getCorrelationId());
        MDC.put(IDEMPOTENCY_KEY, message.getIdempotencyKey());
        MDC.put(TRACE_ID, message.getCorrelationId());
    }

    public static void clear() {
        MDC.remove(MESSAGE_ID);
        MDC.remove(CORRELATION_ID);
        MDC.remove(IDEMPOTENCY_KEY);
        MDC.remove(TRACE_ID);
    }
}
