package org.healthdata.mq.mq;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.config.MessageQueueProperties;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.exception.LedgerUnavailableException;
import org.healthdata.mq.exception.MalformedMessageException;
import org.healthdata.mq.exception.ProcessingFailureException;
import org.healthdata.mq.exception.PublishFailureException;
import org.healthdata.mq.exception.RetryExhaustedException;
import org.healthdata.mq.metrics.MessageQueueMetrics;
import org.healthdata.mq.processor.MessageProcessor;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.healthdata.mq.util.TraceIdUtil;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * 幂等消费者
 * - 手动确认：每次投递最终只有一次 ack 或 nack
 * - 去重台账保证同一幂等键的回调最多成功执行一次
 * - 失败按延迟表投递到重试队列，重试用尽后转入死信交换机
 * - 无法解析的消息直接死信，不重试
 *
 * 单次投递处理流程：
 * 1. 反序列化
 * 2. 去重检查（或原子占用）
 * 3. 标记 processing，调用处理器
 * 4. 成功：标记 completed，ack
 * 5. 失败：标记 failed，重试或死信，ack
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "health.mq.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IdempotentHealthDataConsumer implements ChannelAwareMessageListener, SmartLifecycle {

    private final ConnectionFactory connectionFactory;
    private final IDeduplicationLedger deduplicationLedger;
    private final HealthDataPublisher publisher;
    private final HealthDataMessageCodec codec;
    private final MessageProcessor processor;
    private final MessageQueueMetrics metrics;
    private final MessageQueueProperties properties;

    private final Object lifecycleMonitor = new Object();
    private volatile SimpleMessageListenerContainer container;
    private volatile boolean stopRequested;

    /**
     * 最近一次致命错误（台账不可达/发布失败），处理成功后清空
     */
    private volatile Exception lastFatalError;

    public IdempotentHealthDataConsumer(ConnectionFactory connectionFactory,
                                        IDeduplicationLedger deduplicationLedger,
                                        HealthDataPublisher publisher,
                                        HealthDataMessageCodec codec,
                                        MessageProcessor processor,
                                        MessageQueueMetrics metrics,
                                        MessageQueueProperties properties) {
        this.connectionFactory = connectionFactory;
        this.deduplicationLedger = deduplicationLedger;
        this.publisher = publisher;
        this.codec = codec;
        this.processor = processor;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public void onMessage(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        if (stopRequested) {
            // 停止后到达的消息不写台账，直接退回队列
            log.info("[消费者停止中，消息退回队列] deliveryTag={}, messageId={}",
                    deliveryTag, message.getMessageProperties().getMessageId());
            channel.basicNack(deliveryTag, false, true);
            return;
        }

        try {
            HealthDataMessage healthMessage = codec.deserialize(message.getBody());
            TraceIdUtil.bind(healthMessage);
            handle(healthMessage, deliveryTag, channel);

        } catch (MalformedMessageException e) {
            handleMalformed(message, deliveryTag, channel, e);

        } catch (LedgerUnavailableException e) {
            // 台账不可达：不能判断是否重复，退回队列等待恢复
            boolean firstFailure = !(lastFatalError instanceof LedgerUnavailableException);
            lastFatalError = e;
            metrics.recordLedgerUnavailable(processingQueue());
            if (firstFailure) {
                log.error("[台账不可达，消息退回队列] deliveryTag={}, errorMsg={}", deliveryTag, e.getMessage());
            } else {
                log.debug("[台账仍不可达，消息退回队列] deliveryTag={}, errorMsg={}", deliveryTag, e.getMessage());
            }
            pauseBeforeRequeue();
            channel.basicNack(deliveryTag, false, true);

        } catch (PublishFailureException e) {
            // 重试/死信发布失败：交给队列自身的死信兜底
            lastFatalError = e;
            log.error("[重新发布失败，消息交由队列死信] deliveryTag={}, errorMsg={}", deliveryTag, e.getMessage(), e);
            channel.basicNack(deliveryTag, false, false);

        } catch (Exception e) {
            log.error("[消息处理异常] deliveryTag={}, errorMsg={}", deliveryTag, e.getMessage(), e);
            channel.basicNack(deliveryTag, false, false);

        } finally {
            TraceIdUtil.clear();
        }
    }

    private void handle(HealthDataMessage message, long deliveryTag, Channel channel) throws IOException {
        String idempotencyKey = message.getIdempotencyKey();
        String recordType = message.getRecordType();

        log.info("[收到健康数据消息] messageId={}, idempotencyKey={}, recordType={}, retryCount={}",
                message.getMessageId(), idempotencyKey, recordType, message.getRetryCount());

        // ==================== 1. 去重检查 ====================
        if (!claim(message)) {
            channel.basicAck(deliveryTag, false);
            metrics.recordDuplicateMessage(recordType);
            log.info("[重复消息，已跳过] messageId={}, idempotencyKey={}", message.getMessageId(), idempotencyKey);
            return;
        }

        // ==================== 2. 调用处理器 ====================
        long startTime = System.nanoTime();
        ProcessingFailureException failure = null;
        try {
            if (!processor.process(message)) {
                failure = new ProcessingFailureException(idempotencyKey, "处理器返回失败");
            }
        } catch (Exception e) {
            failure = new ProcessingFailureException(idempotencyKey, "处理器异常: " + e.getMessage(), e);
        }

        // ==================== 3. 处理失败 ====================
        if (failure != null) {
            handleFailure(message, failure, deliveryTag, channel);
            return;
        }

        // ==================== 4. 处理成功 ====================
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startTime);
        deduplicationLedger.markProcessingCompleted(idempotencyKey, elapsed);
        channel.basicAck(deliveryTag, false);
        metrics.recordProcessingSuccess(processingQueue(), recordType, elapsed);
        lastFatalError = null;
        log.info("[消息处理成功] messageId={}, idempotencyKey={}, duration={}ms",
                message.getMessageId(), idempotencyKey, elapsed.toMillis());
    }

    /**
     * 占用幂等键，返回false表示重复
     */
    private boolean claim(HealthDataMessage message) {
        if (properties.getDedup().isAtomicClaim()) {
            return deduplicationLedger.tryClaim(message);
        }
        if (deduplicationLedger.isAlreadyProcessed(message.getIdempotencyKey())) {
            return false;
        }
        deduplicationLedger.markProcessingStarted(message);
        return true;
    }

    private void handleFailure(HealthDataMessage message, ProcessingFailureException failure,
                               long deliveryTag, Channel channel) throws IOException {
        String idempotencyKey = message.getIdempotencyKey();
        String recordType = message.getRecordType();
        int maxRetries = properties.getRetry().getMaxRetries();

        log.warn("[消息处理失败] messageId={}, idempotencyKey={}, retryCount={}, errorMsg={}",
                message.getMessageId(), idempotencyKey, message.getRetryCount(), failure.getMessage(), failure);
        deduplicationLedger.markProcessingFailed(idempotencyKey, failure.getMessage());
        metrics.recordProcessingFailure(processingQueue(), recordType);

        int attemptsSoFar = message.getRetryCount();
        if (attemptsSoFar < maxRetries) {
            message.incrementRetry();
            int delaySeconds = message.retryDelaySeconds(properties.getRetry().getDelaysSeconds());
            publisher.publishRetry(message, delaySeconds);
            channel.basicAck(deliveryTag, false);
            metrics.recordRetryScheduled(recordType, message.getRetryCount(), delaySeconds);
            return;
        }

        RetryExhaustedException exhausted = new RetryExhaustedException(idempotencyKey, attemptsSoFar, maxRetries, failure);
        publisher.publishToDeadLetter(message, exhausted.getMessage());
        channel.basicAck(deliveryTag, false);
        metrics.recordPermanentFailure(recordType);
        log.error("[重试次数用尽] messageId={}, idempotencyKey={}, retryCount={}, maxRetries={}",
                message.getMessageId(), idempotencyKey, attemptsSoFar, maxRetries);
    }

    private void handleMalformed(Message message, long deliveryTag, Channel channel,
                                 MalformedMessageException e) throws IOException {
        metrics.recordMalformedMessage(processingQueue());
        log.error("[消息格式错误] deliveryTag={}, messageId={}, errorMsg={}",
                deliveryTag, message.getMessageProperties().getMessageId(), e.getMessage());
        try {
            publisher.publishRawToDeadLetter(message.getBody(), message.getMessageProperties(), e.getMessage());
            channel.basicAck(deliveryTag, false);
        } catch (PublishFailureException publishError) {
            lastFatalError = publishError;
            log.error("[畸形消息死信发布失败] deliveryTag={}, errorMsg={}", deliveryTag, publishError.getMessage(), publishError);
            channel.basicNack(deliveryTag, false, false);
        }
    }

    /**
     * 退回队列前暂停，避免台账恢复前同一条消息被立即重投而空转
     */
    private void pauseBeforeRequeue() {
        long pauseMillis = properties.getConsumer().getRequeueDelay().toMillis();
        if (pauseMillis <= 0 || stopRequested) {
            return;
        }
        try {
            Thread.sleep(pauseMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (container != null && container.isRunning()) {
                return;
            }
            MessageQueueProperties.Consumer consumer = properties.getConsumer();
            SimpleMessageListenerContainer listenerContainer = new SimpleMessageListenerContainer(connectionFactory);
            listenerContainer.setQueueNames(processingQueue());
            listenerContainer.setAcknowledgeMode(AcknowledgeMode.MANUAL);
            listenerContainer.setPrefetchCount(consumer.getPrefetch());
            listenerContainer.setConcurrentConsumers(consumer.getConcurrency());
            listenerContainer.setShutdownTimeout(consumer.getShutdownTimeout().toMillis());
            listenerContainer.setDefaultRequeueRejected(false);
            listenerContainer.setMessageListener(this);
            listenerContainer.afterPropertiesSet();

            stopRequested = false;
            listenerContainer.start();
            container = listenerContainer;
            log.info("[消费者已启动] queue={}, prefetch={}, concurrency={}, atomicClaim={}",
                    processingQueue(), consumer.getPrefetch(), consumer.getConcurrency(),
                    properties.getDedup().isAtomicClaim());
        }
    }

    /**
     * 协作式停止：不再接收新消息，等待处理中的消息完成ack/nack
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            stopRequested = true;
            SimpleMessageListenerContainer listenerContainer = container;
            if (listenerContainer == null) {
                return;
            }
            listenerContainer.stop();
            listenerContainer.destroy();
            container = null;
            log.info("[消费者已停止] queue={}", processingQueue());
        }
    }

    @Override
    public boolean isRunning() {
        SimpleMessageListenerContainer listenerContainer = container;
        return listenerContainer != null && listenerContainer.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getConsumer().isAutoStartup();
    }

    public Exception getLastFatalError() {
        return lastFatalError;
    }

    private String processingQueue() {
        return properties.getQueue().getProcessing();
    }
}
