package org.healthdata.mq.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 消息队列指标
 * - 发布、处理、重试、重复、畸形消息、永久失败
 * - 通过构造注入MeterRegistry，不使用全局单例
 */
@Component
public class MessageQueueMetrics {

    public static final String MESSAGES_PUBLISHED = "mq.messages.published";
    public static final String PUBLISH_DURATION = "mq.publish.duration";
    public static final String MESSAGES_PROCESSED = "mq.messages.processed";
    public static final String PROCESSING_DURATION = "mq.processing.duration";
    public static final String RETRY_SCHEDULED = "mq.retry.scheduled";
    public static final String RETRY_ATTEMPTS = "mq.retry.attempts";
    public static final String DUPLICATE_MESSAGES = "mq.duplicate.messages";
    public static final String PERMANENT_FAILURES = "mq.permanent.failures";
    public static final String MALFORMED_MESSAGES = "mq.malformed.messages";
    public static final String LEDGER_UNAVAILABLE = "mq.ledger.unavailable";

    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_FAILED = "failed";

    private final MeterRegistry registry;

    public MessageQueueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPublishSuccess(String exchange, String routingKey, Duration duration) {
        Counter.builder(MESSAGES_PUBLISHED)
                .tag("exchange", exchange)
                .tag("routing_key", routingKey)
                .tag("status", STATUS_SUCCESS)
                .register(registry)
                .increment();
        Timer.builder(PUBLISH_DURATION)
                .tag("exchange", exchange)
                .register(registry)
                .record(duration);
    }

    public void recordPublishFailure(String exchange) {
        Counter.builder(MESSAGES_PUBLISHED)
                .tag("exchange", exchange)
                .tag("routing_key", "unknown")
                .tag("status", STATUS_FAILED)
                .register(registry)
                .increment();
    }

    public void recordProcessingSuccess(String queue, String recordType, Duration duration) {
        processedCounter(queue, recordType, STATUS_SUCCESS).increment();
        Timer.builder(PROCESSING_DURATION)
                .tag("queue", queue)
                .tag("record_type", recordType)
                .register(registry)
                .record(duration);
    }

    public void recordProcessingFailure(String queue, String recordType) {
        processedCounter(queue, recordType, STATUS_FAILED).increment();
    }

    public void recordRetryScheduled(String recordType, int retryCount, int delaySeconds) {
        Counter.builder(RETRY_SCHEDULED)
                .tag("record_type", recordType)
                .tag("delay_seconds", String.valueOf(delaySeconds))
                .register(registry)
                .increment();
        Counter.builder(RETRY_ATTEMPTS)
                .tag("record_type", recordType)
                .tag("retry_count", String.valueOf(retryCount))
                .register(registry)
                .increment();
    }

    public void recordDuplicateMessage(String recordType) {
        Counter.builder(DUPLICATE_MESSAGES)
                .tag("record_type", recordType)
                .register(registry)
                .increment();
    }

    public void recordPermanentFailure(String recordType) {
        Counter.builder(PERMANENT_FAILURES)
                .tag("record_type", recordType)
                .register(registry)
                .increment();
    }

    public void recordMalformedMessage(String queue) {
        Counter.builder(MALFORMED_MESSAGES)
                .tag("queue", queue)
                .register(registry)
                .increment();
    }

    public void recordLedgerUnavailable(String queue) {
        Counter.builder(LEDGER_UNAVAILABLE)
                .tag("queue", queue)
                .register(registry)
                .increment();
    }

    private Counter processedCounter(String queue, String recordType, String status) {
        return Counter.builder(MESSAGES_PROCESSED)
                .tag("queue", queue)
                .tag("record_type", recordType)
                .tag("status", status)
                .register(registry);
    }
}
