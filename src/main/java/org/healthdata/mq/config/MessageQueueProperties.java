package org.healthdata.mq.config;

import lombok.Getter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 消息队列配置（启动时构造一次，之后不可变）
 *
 * 绑定 application.yml 中 "health.mq" 前缀：
 *   health:
 *     mq:
 *       exchange:
 *         main: health_data_exchange
 *         dead-letter: health_data_dlx
 *       retry:
 *         max-retries: 3
 *         delays-seconds: [30, 300, 900]
 *       dedup:
 *         retention-hours: 72
 */
@Getter
@ToString
@ConfigurationProperties(prefix = "health.mq")
public class MessageQueueProperties {

    private final Exchange exchange;
    private final Queue queue;
    private final Retry retry;
    private final Consumer consumer;
    private final Publisher publisher;
    private final Dedup dedup;

    public MessageQueueProperties(@DefaultValue Exchange exchange,
                                  @DefaultValue Queue queue,
                                  @DefaultValue Retry retry,
                                  @DefaultValue Consumer consumer,
                                  @DefaultValue Publisher publisher,
                                  @DefaultValue Dedup dedup) {
        this.exchange = exchange;
        this.queue = queue;
        this.retry = retry;
        this.consumer = consumer;
        this.publisher = publisher;
        this.dedup = dedup;
    }

    @Getter
    @ToString
    public static class Exchange {

        /**
         * 主交换机（topic）
         */
        private final String main;

        /**
         * 死信交换机（topic）
         */
        private final String deadLetter;

        public Exchange(@DefaultValue("health_data_exchange") String main,
                        @DefaultValue("health_data_dlx") String deadLetter) {
            this.main = requireText(main, "health.mq.exchange.main");
            this.deadLetter = requireText(deadLetter, "health.mq.exchange.dead-letter");
        }
    }

    @Getter
    @ToString
    public static class Queue {

        private final String processing;
        private final String failed;

        /**
         * 重试队列名前缀，完整名称为 前缀 + 延迟秒数 + "s"
         */
        private final String retryPrefix;

        /**
         * 主队列消息存活时间，超时后进入死信
         */
        private final Duration messageTtl;

        public Queue(@DefaultValue("health_data_processing") String processing,
                     @DefaultValue("health_data_failed") String failed,
                     @DefaultValue("health_data_retry_") String retryPrefix,
                     @DefaultValue("30m") Duration messageTtl) {
            this.processing = requireText(processing, "health.mq.queue.processing");
            this.failed = requireText(failed, "health.mq.queue.failed");
            this.retryPrefix = requireText(retryPrefix, "health.mq.queue.retry-prefix");
            this.messageTtl = requirePositive(messageTtl, "health.mq.queue.message-ttl");
        }
    }

    @Getter
    @ToString
    public static class Retry {

        private final int maxRetries;

        /**
         * 升序的重试延迟（秒），每个值对应一个TTL重试队列
         */
        private final List<Integer> delaysSeconds;

        public Retry(@DefaultValue("3") int maxRetries,
                     @DefaultValue({"30", "300", "900"}) List<Integer> delaysSeconds) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("health.mq.retry.max-retries 不能为负数: " + maxRetries);
            }
            if (delaysSeconds == null || delaysSeconds.isEmpty()) {
                throw new IllegalArgumentException("health.mq.retry.delays-seconds 不能为空");
            }
            List<Integer> sorted = new ArrayList<>(delaysSeconds);
            for (Integer delay : sorted) {
                if (delay == null || delay <= 0) {
                    throw new IllegalArgumentException("health.mq.retry.delays-seconds 必须为正数: " + delaysSeconds);
                }
            }
            Collections.sort(sorted);
            this.maxRetries = maxRetries;
            this.delaysSeconds = Collections.unmodifiableList(sorted);
        }
    }

    @Getter
    @ToString
    public static class Consumer {

        private final boolean enabled;
        private final boolean autoStartup;
        private final int prefetch;
        private final int concurrency;

        /**
         * stop() 等待处理中消息完成的最长时间
         */
        private final Duration shutdownTimeout;

        /**
         * 台账不可达时，消息退回队列前的暂停时间（0表示不暂停）
         */
        private final Duration requeueDelay;

        public Consumer(@DefaultValue("true") boolean enabled,
                        @DefaultValue("true") boolean autoStartup,
                        @DefaultValue("1") int prefetch,
                        @DefaultValue("1") int concurrency,
                        @DefaultValue("60s") Duration shutdownTimeout,
                        @DefaultValue("1s") Duration requeueDelay) {
            if (prefetch < 1 || concurrency < 1) {
                throw new IllegalArgumentException("health.mq.consumer.prefetch/concurrency 必须大于0");
            }
            this.enabled = enabled;
            this.autoStartup = autoStartup;
            this.prefetch = prefetch;
            this.concurrency = concurrency;
            this.shutdownTimeout = requirePositive(shutdownTimeout, "health.mq.consumer.shutdown-timeout");
            if (requeueDelay == null || requeueDelay.isNegative() || requeueDelay.compareTo(shutdownTimeout) > 0) {
                throw new IllegalArgumentException("health.mq.consumer.requeue-delay 必须在0和shutdown-timeout之间: " + requeueDelay);
            }
            this.requeueDelay = requeueDelay;
        }
    }

    @Getter
    @ToString
    public static class Publisher {

        private final int maxAttempts;
        private final Duration initialInterval;
        private final double multiplier;
        private final Duration maxInterval;

        /**
         * 等待broker确认的超时时间
         */
        private final Duration confirmTimeout;

        public Publisher(@DefaultValue("3") int maxAttempts,
                         @DefaultValue("1s") Duration initialInterval,
                         @DefaultValue("2.0") double multiplier,
                         @DefaultValue("5s") Duration maxInterval,
                         @DefaultValue("10s") Duration confirmTimeout) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("health.mq.publisher.max-attempts 必须大于0");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("health.mq.publisher.multiplier 不能小于1");
            }
            this.maxAttempts = maxAttempts;
            this.initialInterval = requirePositive(initialInterval, "health.mq.publisher.initial-interval");
            this.multiplier = multiplier;
            this.maxInterval = requirePositive(maxInterval, "health.mq.publisher.max-interval");
            this.confirmTimeout = requirePositive(confirmTimeout, "health.mq.publisher.confirm-timeout");
        }
    }

    @Getter
    @ToString
    public static class Dedup {

        private final String keyPrefix;
        private final int retentionHours;
        private final int failedRetentionHours;

        /**
         * processing状态的TTL，未配置时等于保留窗口
         */
        private final Duration processingTtl;

        /**
         * true时用原子claim替代"先查后写"
         */
        private final boolean atomicClaim;

        private final Duration cleanupInterval;

        public Dedup(@DefaultValue("health:dedup:") String keyPrefix,
                     @DefaultValue("72") int retentionHours,
                     @DefaultValue("72") int failedRetentionHours,
                     Duration processingTtl,
                     @DefaultValue("false") boolean atomicClaim,
                     @DefaultValue("1h") Duration cleanupInterval) {
            if (retentionHours < 1 || failedRetentionHours < 1) {
                throw new IllegalArgumentException("health.mq.dedup 保留时间必须大于0小时");
            }
            this.keyPrefix = keyPrefix != null ? keyPrefix : "";
            this.retentionHours = retentionHours;
            this.failedRetentionHours = failedRetentionHours;
            this.processingTtl = processingTtl != null
                    ? requirePositive(processingTtl, "health.mq.dedup.processing-ttl")
                    : Duration.ofHours(retentionHours);
            this.atomicClaim = atomicClaim;
            this.cleanupInterval = requirePositive(cleanupInterval, "health.mq.dedup.cleanup-interval");
        }

        public Duration getRetention() {
            return Duration.ofHours(retentionHours);
        }

        public Duration getFailedRetention() {
            return Duration.ofHours(failedRetentionHours);
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " 必须为正数: " + value);
        }
        return value;
    }
}
