package org.healthdata.mq.mq;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.config.MessageQueueProperties;
import org.healthdata.mq.config.RetryTopology;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.exception.PublishFailureException;
import org.healthdata.mq.exception.UnroutableMessageException;
import org.healthdata.mq.metrics.MessageQueueMetrics;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageBuilderSupport;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 健康数据消息发布器
 * - 持久化消息 + mandatory + 发布确认：broker确认前不算发布成功，无队列绑定时直接失败
 * - 只重试"发布"这一步（不是业务逻辑）：指数退避，默认3次，1s起，倍数2，上限5s
 * - 同时负责把消息投递到重试队列和死信交换机
 */
@Slf4j
@Component
public class HealthDataPublisher {

    public static final String HEADER_RETRY_COUNT = "retry_count";
    public static final String HEADER_IDEMPOTENCY_KEY = "idempotency_key";
    public static final String HEADER_RECORD_TYPE = "record_type";
    public static final String HEADER_USER_ID = "user_id";
    public static final String HEADER_PROCESSING_PRIORITY = "processing_priority";
    public static final String HEADER_ORIGINAL_ROUTING_KEY = "original_routing_key";
    public static final String HEADER_RETRY_ROUTING_KEY = "retry_routing_key";
    public static final String HEADER_RETRY_DELAY_SECONDS = "retry_delay_seconds";
    public static final String HEADER_FAILURE_REASON = "x-failure-reason";

    /**
     * 默认交换机，按队列名直接路由
     */
    private static final String DEFAULT_EXCHANGE = "";

    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final RetryTopology retryTopology;
    private final HealthDataMessageCodec codec;
    private final MessageQueueMetrics metrics;
    private final MessageQueueProperties properties;
    private final RetryTemplate retryTemplate;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HealthDataPublisher(RabbitTemplate rabbitTemplate,
                               AmqpAdmin amqpAdmin,
                               RetryTopology retryTopology,
                               HealthDataMessageCodec codec,
                               MessageQueueMetrics metrics,
                               MessageQueueProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.retryTopology = retryTopology;
        this.codec = codec;
        this.metrics = metrics;
        this.properties = properties;
        this.retryTemplate = buildRetryTemplate(properties.getPublisher());
    }

    /**
     * 声明主交换机（幂等，可重复调用）
     */
    public void initialize() {
        if (closed.get()) {
            throw new IllegalStateException("发布器已关闭");
        }
        if (initialized.get()) {
            return;
        }
        synchronized (this) {
            if (initialized.get()) {
                return;
            }
            amqpAdmin.declareExchange(retryTopology.mainExchange());
            initialized.set(true);
            log.info("[发布器初始化完成] exchange={}", properties.getExchange().getMain());
        }
    }

    /**
     * 发布健康数据消息到主交换机
     *
     * 执行流程：
     * 1. 序列化消息，设置持久化、时间戳、追踪头
     * 2. 按 message.routingKey() 发送（mandatory）
     * 3. 等待broker确认，nack/超时/连接异常时指数退避重试
     * 4. 被退回（无队列绑定）时不重试，直接失败
     *
     * @param message 健康数据消息
     * @return 发布成功返回true，失败抛出 PublishFailureException
     */
    public boolean publish(HealthDataMessage message) {
        initialize();
        String exchange = properties.getExchange().getMain();
        String routingKey = message.routingKey();

        Message amqpMessage = MessageBuilder.withBody(codec.serialize(message))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding("UTF-8")
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(message.getMessageId())
                .setCorrelationId(message.getCorrelationId())
                .setTimestamp(new Date())
                .setHeader(HEADER_RETRY_COUNT, message.getRetryCount())
                .setHeader(HEADER_IDEMPOTENCY_KEY, message.getIdempotencyKey())
                .setHeader(HEADER_RECORD_TYPE, message.getRecordType())
                .setHeader(HEADER_USER_ID, message.getUserId())
                .setHeader(HEADER_PROCESSING_PRIORITY, message.getProcessingPriority().getToken())
                .build();

        sendWithRetry(exchange, routingKey, amqpMessage, message.getMessageId());
        log.info("[消息已发布] messageId={}, correlationId={}, idempotencyKey={}, routingKey={}",
                message.getMessageId(), message.getCorrelationId(), message.getIdempotencyKey(), routingKey);
        return true;
    }

    /**
     * 投递到延迟对应的重试队列，TTL到期后死信回主交换机
     *
     * @param message 已经 incrementRetry 的消息
     * @param delaySeconds 延迟秒数
     */
    public void publishRetry(HealthDataMessage message, int delaySeconds) {
        initialize();
        String retryQueue = retryTopology.retryQueueName(delaySeconds);

        Message amqpMessage = MessageBuilder.withBody(codec.serialize(message))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding("UTF-8")
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(message.getMessageId())
                .setCorrelationId(message.getCorrelationId())
                .setTimestamp(new Date())
                .setHeader(HEADER_RETRY_COUNT, message.getRetryCount())
                .setHeader(HEADER_IDEMPOTENCY_KEY, message.getIdempotencyKey())
                .setHeader(HEADER_ORIGINAL_ROUTING_KEY, message.routingKey())
                .setHeader(HEADER_RETRY_ROUTING_KEY, message.retryRoutingKey())
                .setHeader(HEADER_RETRY_DELAY_SECONDS, delaySeconds)
                .build();

        sendWithRetry(DEFAULT_EXCHANGE, retryQueue, amqpMessage, message.getMessageId());
        log.info("[消息已安排重试] messageId={}, idempotencyKey={}, retryCount={}, delaySeconds={}, retryQueue={}, retryRoutingKey={}",
                message.getMessageId(), message.getIdempotencyKey(), message.getRetryCount(), delaySeconds,
                retryQueue, message.retryRoutingKey());
    }

    /**
     * 投递到死信交换机（永久失败）
     * retry_count 为已经安排过的重试次数，重试用尽时等于 max-retries
     */
    public void publishToDeadLetter(HealthDataMessage message, String reason) {
        Message amqpMessage = MessageBuilder.withBody(codec.serialize(message))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding("UTF-8")
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(message.getMessageId())
                .setCorrelationId(message.getCorrelationId())
                .setTimestamp(new Date())
                .setHeader(HEADER_RETRY_COUNT, message.getRetryCount())
                .setHeader(HEADER_IDEMPOTENCY_KEY, message.getIdempotencyKey())
                .setHeader(HEADER_RECORD_TYPE, message.getRecordType())
                .setHeader(HEADER_FAILURE_REASON, reason)
                .build();

        sendWithRetry(properties.getExchange().getDeadLetter(), RetryTopology.RETRIES_EXHAUSTED_ROUTING_KEY,
                amqpMessage, message.getMessageId());
        log.error("[消息转入永久失败队列] messageId={}, idempotencyKey={}, retryCount={}, reason={}",
                message.getMessageId(), message.getIdempotencyKey(), message.getRetryCount(), reason);
    }

    public void publishRawToDeadLetter(byte[] body, String reason) {
        publishRawToDeadLetter(body, null, reason);
    }

    /**
     * 无法解析的原始消息体直接投递到死信交换机
     */
    public void publishRawToDeadLetter(byte[] body, MessageProperties originalProperties, String reason) {
        String messageId = originalProperties != null ? originalProperties.getMessageId() : null;
        MessageBuilderSupport<Message> builder = MessageBuilder.withBody(body != null ? body : new byte[0])
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setTimestamp(new Date())
                .setHeader(HEADER_FAILURE_REASON, reason);
        if (messageId != null) {
            builder.setMessageId(messageId);
        }
        if (originalProperties != null && originalProperties.getContentType() != null) {
            builder.setContentType(originalProperties.getContentType());
        }

        sendWithRetry(properties.getExchange().getDeadLetter(), RetryTopology.MALFORMED_ROUTING_KEY,
                builder.build(), messageId != null ? messageId : "unknown");
        log.error("[畸形消息已转入死信] messageId={}, reason={}", messageId, reason);
    }

    /**
     * 连接存活检查
     */
    public boolean checkConnection() {
        if (closed.get()) {
            return false;
        }
        try (Connection connection = rabbitTemplate.getConnectionFactory().createConnection()) {
            return connection != null && connection.isOpen();
        } catch (AmqpException e) {
            log.warn("[RabbitMQ连接检查失败] errorMsg={}", e.getMessage());
            return false;
        }
    }

    /**
     * 关闭发布器，可重复调用
     */
    @PreDestroy
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("[发布器已关闭]");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void sendWithRetry(String exchange, String routingKey, Message amqpMessage, String messageId) {
        if (closed.get()) {
            throw new IllegalStateException("发布器已关闭，无法发布: messageId=" + messageId);
        }
        long startTime = System.nanoTime();
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[发布重试] messageId={}, exchange={}, routingKey={}, attempt={}, lastError={}",
                            messageId, exchange, routingKey, context.getRetryCount() + 1,
                            context.getLastThrowable() != null ? context.getLastThrowable().getMessage() : null);
                }
                sendAndConfirm(exchange, routingKey, amqpMessage, messageId);
                return null;
            });
            metrics.recordPublishSuccess(exchange, routingKey, Duration.ofNanos(System.nanoTime() - startTime));
        } catch (UnroutableMessageException e) {
            metrics.recordPublishFailure(exchange);
            log.error("[消息无法路由] messageId={}, exchange={}, routingKey={}", messageId, exchange, routingKey);
            throw e;
        } catch (PublishFailureException e) {
            metrics.recordPublishFailure(exchange);
            log.error("[消息发布失败] messageId={}, exchange={}, routingKey={}, errorMsg={}",
                    messageId, exchange, routingKey, e.getMessage(), e);
            throw e;
        } catch (AmqpException e) {
            metrics.recordPublishFailure(exchange);
            log.error("[消息发布失败] messageId={}, exchange={}, routingKey={}, errorMsg={}",
                    messageId, exchange, routingKey, e.getMessage(), e);
            throw new PublishFailureException("消息发布失败，已重试"
                    + properties.getPublisher().getMaxAttempts() + "次: messageId=" + messageId, e);
        }
    }

    /**
     * 发送一次并等待broker确认
     */
    private void sendAndConfirm(String exchange, String routingKey, Message amqpMessage, String messageId) {
        CorrelationData correlationData = new CorrelationData(messageId + ":" + UUID.randomUUID());
        rabbitTemplate.send(exchange, routingKey, amqpMessage, correlationData);

        CorrelationData.Confirm confirm;
        try {
            confirm = correlationData.getFuture()
                    .get(properties.getPublisher().getConfirmTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishFailureException("等待发布确认时被中断: messageId=" + messageId, e);
        } catch (ExecutionException e) {
            throw new PublishFailureException("发布确认异常: messageId=" + messageId, e.getCause());
        } catch (TimeoutException e) {
            throw new PublishFailureException("发布确认超时: messageId=" + messageId, e);
        }

        // 退回回调先于确认回调到达
        ReturnedMessage returned = correlationData.getReturned();
        if (returned != null) {
            throw new UnroutableMessageException("消息被退回: messageId=" + messageId
                    + ", exchange=" + returned.getExchange() + ", routingKey=" + returned.getRoutingKey()
                    + ", replyText=" + returned.getReplyText());
        }
        if (!confirm.isAck()) {
            throw new PublishFailureException("broker拒绝消息: messageId=" + messageId + ", reason=" + confirm.getReason());
        }
    }

    private static RetryTemplate buildRetryTemplate(MessageQueueProperties.Publisher publisher) {
        Map<Class<? extends Throwable>, Boolean> retryable = new HashMap<>();
        retryable.put(AmqpException.class, true);
        retryable.put(PublishFailureException.class, true);
        retryable.put(UnroutableMessageException.class, false);
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(publisher.getMaxAttempts(), retryable, true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(publisher.getInitialInterval().toMillis());
        backOffPolicy.setMultiplier(publisher.getMultiplier());
        backOffPolicy.setMaxInterval(publisher.getMaxInterval().toMillis());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
