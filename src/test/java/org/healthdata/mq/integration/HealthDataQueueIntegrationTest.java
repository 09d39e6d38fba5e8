package org.healthdata.mq.integration;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.config.MessageQueueProperties;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.domain.HealthDataMessageFixture;
import org.healthdata.mq.domain.LedgerStatus;
import org.healthdata.mq.metrics.MessageQueueMetrics;
import org.healthdata.mq.mq.HealthDataPublisher;
import org.healthdata.mq.mq.IdempotentHealthDataConsumer;
import org.healthdata.mq.processor.RecordTypeProcessor;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 端到端集成测试（真实RabbitMQ + Redis）
 * - 同一幂等键发布两次只处理一次
 * - 处理失败经TTL重试队列回流后处理成功
 * - 停止时等待处理中的消息完成
 */
@Slf4j
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class HealthDataQueueIntegrationTest {

    @Container
    static final RabbitMQContainer RABBIT = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.12-management-alpine"));

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("spring.rabbitmq.host", RABBIT::getHost);
        registry.add("spring.rabbitmq.port", RABBIT::getAmqpPort);
        registry.add("spring.rabbitmq.username", RABBIT::getAdminUsername);
        registry.add("spring.rabbitmq.password", RABBIT::getAdminPassword);
        registry.add("spring.data.redis.host", REDIS::getHost);
        registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
        registry.add("health.mq.retry.max-retries", () -> 2);
        registry.add("health.mq.retry.delays-seconds", () -> "1,2");
    }

    /**
     * 记录每次处理；healthMetadata 带 fail_first 时第一次处理返回失败
     */
    @TestConfiguration
    static class RecordingProcessorConfig {

        @Bean
        RecordingProcessor recordingProcessor() {
            return new RecordingProcessor();
        }
    }

    static class RecordingProcessor implements RecordTypeProcessor {

        private final List<HealthDataMessage> processed = new CopyOnWriteArrayList<>();
        private final Set<String> failedOnce = ConcurrentHashMap.newKeySet();
        private final CountDownLatch holdEntered = new CountDownLatch(1);
        private final CountDownLatch holdReleased = new CountDownLatch(1);

        @Override
        public String recordType() {
            return "BloodGlucose";
        }

        @Override
        public boolean process(HealthDataMessage message) {
            processed.add(message);
            Map<String, Object> metadata = message.getHealthMetadata();
            if (metadata != null && Boolean.TRUE.equals(metadata.get("hold"))) {
                holdEntered.countDown();
                try {
                    return holdReleased.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            if (metadata != null && Boolean.TRUE.equals(metadata.get("fail_first"))) {
                return !failedOnce.add(message.getIdempotencyKey());
            }
            return true;
        }

        List<HealthDataMessage> processedWithKey(String idempotencyKey) {
            return processed.stream()
                    .filter(message -> message.getIdempotencyKey().equals(idempotencyKey))
                    .collect(Collectors.toList());
        }
    }

    @Autowired
    private HealthDataPublisher publisher;

    @Autowired
    private IdempotentHealthDataConsumer consumer;

    @Autowired
    private IDeduplicationLedger ledger;

    @Autowired
    private RecordingProcessor processor;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private AmqpAdmin amqpAdmin;

    @Autowired
    private MessageQueueProperties properties;

    private double duplicates() {
        return meterRegistry.find(MessageQueueMetrics.DUPLICATE_MESSAGES).counters().stream()
                .mapToDouble(c -> c.count()).sum();
    }

    @Test
    @DisplayName("幂等键X发布两次，只有一条被处理")
    void sameKeyPublishedTwiceProcessedOnce() {
        log.info("====== 测试重复消息 ======");
        double duplicatesBefore = duplicates();

        publisher.publish(HealthDataMessageFixture.bloodGlucose().messageId("first").idempotencyKey("X").build());
        publisher.publish(HealthDataMessageFixture.bloodGlucose().messageId("second").idempotencyKey("X").build());

        await().atMost(Duration.ofSeconds(20))
                .until(() -> duplicates() - duplicatesBefore >= 1.0);

        assertThat(processor.processedWithKey("X")).hasSize(1);
        assertThat(ledger.getRecord("X").orElseThrow().getStatus()).isEqualTo(LedgerStatus.COMPLETED);
        assertThat(consumer.isRunning()).isTrue();
        assertThat(consumer.getLastFatalError()).isNull();
    }

    @Test
    @DisplayName("第一次处理失败，经重试队列回流后处理成功")
    void failedMessageRetriedThroughDelayQueue() {
        log.info("====== 测试延迟重试 ======");
        String key = "retry-" + UUID.randomUUID();

        publisher.publish(HealthDataMessageFixture.bloodGlucose()
                .idempotencyKey(key)
                .healthMetadata(Map.of("fail_first", true))
                .build());

        await().atMost(Duration.ofSeconds(30))
                .until(() -> ledger.getRecord(key)
                        .map(record -> record.getStatus() == LedgerStatus.COMPLETED)
                        .orElse(false));

        List<HealthDataMessage> attempts = processor.processedWithKey(key);
        assertThat(attempts).hasSize(2);
        assertThat(attempts.get(0).getRetryCount()).isZero();
        assertThat(attempts.get(1).getRetryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("stop() 等待处理中的消息写完台账并ack后才返回")
    void stopWaitsForInFlightDelivery() throws Exception {
        log.info("====== 测试协作式停止 ======");
        String key = "hold-" + UUID.randomUUID();
        publisher.publish(HealthDataMessageFixture.bloodGlucose()
                .idempotencyKey(key)
                .healthMetadata(Map.of("hold", true))
                .build());
        assertThat(processor.holdEntered.await(20, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(consumer::stop);
        try {
            await().during(Duration.ofMillis(500)).atMost(Duration.ofSeconds(2))
                    .until(() -> !stopping.isDone());
            assertThat(ledger.getRecord(key).orElseThrow().getStatus()).isEqualTo(LedgerStatus.PROCESSING);

            processor.holdReleased.countDown();
            stopping.get(30, TimeUnit.SECONDS);

            assertThat(consumer.isRunning()).isFalse();
            assertThat(ledger.getRecord(key).orElseThrow().getStatus()).isEqualTo(LedgerStatus.COMPLETED);
            // 未ack的消息在消费者关闭后会回到队列
            QueueInformation queue = amqpAdmin.getQueueInfo(properties.getQueue().getProcessing());
            assertThat(queue).isNotNull();
            assertThat(queue.getMessageCount()).isZero();
        } finally {
            processor.holdReleased.countDown();
            stopping.get(30, TimeUnit.SECONDS);
            consumer.start();
        }
    }

    @Test
    @DisplayName("连接检查和台账可达")
    void connectivity() {
        assertThat(publisher.checkConnection()).isTrue();
        assertThat(ledger.ping()).isTrue();
    }
}
