package org.healthdata.mq.health;

import org.healthdata.mq.mq.HealthDataPublisher;
import org.healthdata.mq.mq.IdempotentHealthDataConsumer;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 消息队列健康检查
 * - 台账不可达、发布器连接不可用、消费者记录了致命错误，任一成立即DOWN
 */
@Component
public class MessageQueueHealthIndicator implements HealthIndicator {

    private final IDeduplicationLedger deduplicationLedger;
    private final HealthDataPublisher publisher;
    private final ObjectProvider<IdempotentHealthDataConsumer> consumerProvider;

    public MessageQueueHealthIndicator(IDeduplicationLedger deduplicationLedger,
                                       HealthDataPublisher publisher,
                                       ObjectProvider<IdempotentHealthDataConsumer> consumerProvider) {
        this.deduplicationLedger = deduplicationLedger;
        this.publisher = publisher;
        this.consumerProvider = consumerProvider;
    }

    @Override
    public Health health() {
        boolean ledgerUp = deduplicationLedger.ping();
        boolean brokerUp = publisher.checkConnection();

        Health.Builder builder = (ledgerUp && brokerUp) ? Health.up() : Health.down();
        builder.withDetail("ledger", ledgerUp ? "UP" : "DOWN")
                .withDetail("broker", brokerUp ? "UP" : "DOWN");

        IdempotentHealthDataConsumer consumer = consumerProvider.getIfAvailable();
        if (consumer != null) {
            builder.withDetail("consumerRunning", consumer.isRunning());
            Exception fatalError = consumer.getLastFatalError();
            if (fatalError != null) {
                builder.down()
                        .withDetail("lastFatalError", fatalError.getClass().getSimpleName() + ": " + fatalError.getMessage());
            }
        }
        return builder.build();
    }
}
