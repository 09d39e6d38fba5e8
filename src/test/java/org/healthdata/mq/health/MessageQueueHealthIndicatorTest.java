package org.healthdata.mq.health;

import org.healthdata.mq.exception.LedgerUnavailableException;
import org.healthdata.mq.mq.HealthDataPublisher;
import org.healthdata.mq.mq.IdempotentHealthDataConsumer;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageQueueHealthIndicatorTest {

    @Mock
    private IDeduplicationLedger ledger;

    @Mock
    private HealthDataPublisher publisher;

    @Mock
    private IdempotentHealthDataConsumer consumer;

    @Mock
    private ObjectProvider<IdempotentHealthDataConsumer> consumerProvider;

    @Test
    @DisplayName("台账、broker可达且无致命错误时UP")
    void up() {
        when(ledger.ping()).thenReturn(true);
        when(publisher.checkConnection()).thenReturn(true);
        when(consumerProvider.getIfAvailable()).thenReturn(consumer);
        when(consumer.isRunning()).thenReturn(true);
        when(consumer.getLastFatalError()).thenReturn(null);

        Health health = new MessageQueueHealthIndicator(ledger, publisher, consumerProvider).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("ledger", "UP").containsEntry("consumerRunning", true);
    }

    @Test
    @DisplayName("台账不可达时DOWN")
    void ledgerDown() {
        when(ledger.ping()).thenReturn(false);
        when(publisher.checkConnection()).thenReturn(true);
        when(consumerProvider.getIfAvailable()).thenReturn(null);

        Health health = new MessageQueueHealthIndicator(ledger, publisher, consumerProvider).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("ledger", "DOWN");
    }

    @Test
    @DisplayName("消费者记录了致命错误时DOWN")
    void fatalErrorDown() {
        when(ledger.ping()).thenReturn(true);
        when(publisher.checkConnection()).thenReturn(true);
        when(consumerProvider.getIfAvailable()).thenReturn(consumer);
        when(consumer.isRunning()).thenReturn(true);
        when(consumer.getLastFatalError()).thenReturn(new LedgerUnavailableException("去重台账不可用", null));

        Health health = new MessageQueueHealthIndicator(ledger, publisher, consumerProvider).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat((String) health.getDetails().get("lastFatalError")).contains("LedgerUnavailableException");
    }
}
