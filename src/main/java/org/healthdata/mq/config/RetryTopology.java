package org.healthdata.mq.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

import java.util.ArrayList;
import java.util.List;

/**
 * 延迟重试拓扑
 * - 主交换机 + 死信交换机（topic，持久化）
 * - 主处理队列：绑定 health.processing.#，消息超时后进入死信交换机（failed.processing）
 * - 失败队列：绑定死信交换机 failed.#，永久失败消息的终点
 * - 每个延迟值一个重试队列：TTL到期后死信回主交换机，重新进入主处理队列
 *
 * RabbitMQ没有原生的延迟投递，这里用 TTL + 死信 链实现"延迟可见"。
 * 所有声明都是幂等的，可重复执行。
 */
@Slf4j
public class RetryTopology {

    public static final String PROCESSING_BINDING_PATTERN = "health.processing.#";
    public static final String FAILED_BINDING_PATTERN = "failed.#";

    /**
     * 主队列消息超时（系统兜底路径）的死信路由键
     */
    public static final String EXPIRED_ROUTING_KEY = "failed.processing";

    /**
     * 重试队列TTL到期后回到主交换机使用的路由键，被 health.processing.# 匹配
     */
    public static final String REDELIVERY_ROUTING_KEY = "health.processing.retry";

    public static final String RETRIES_EXHAUSTED_ROUTING_KEY = "failed.retries_exhausted";
    public static final String MALFORMED_ROUTING_KEY = "failed.malformed";

    private final MessageQueueProperties properties;

    public RetryTopology(MessageQueueProperties properties) {
        this.properties = properties;
    }

    public TopicExchange mainExchange() {
        return new TopicExchange(properties.getExchange().getMain(), true, false);
    }

    public TopicExchange deadLetterExchange() {
        return new TopicExchange(properties.getExchange().getDeadLetter(), true, false);
    }

    public Queue processingQueue() {
        return QueueBuilder.durable(properties.getQueue().getProcessing())
                .ttl((int) properties.getQueue().getMessageTtl().toMillis())
                .deadLetterExchange(properties.getExchange().getDeadLetter())
                .deadLetterRoutingKey(EXPIRED_ROUTING_KEY)
                .build();
    }

    public Queue failedQueue() {
        return QueueBuilder.durable(properties.getQueue().getFailed()).build();
    }

    /**
     * 某个延迟对应的重试队列，不直接绑定交换机，通过默认交换机按队列名投递
     */
    public Queue retryQueue(int delaySeconds) {
        return QueueBuilder.durable(retryQueueName(delaySeconds))
                .ttl(delaySeconds * 1000)
                .deadLetterExchange(properties.getExchange().getMain())
                .deadLetterRoutingKey(REDELIVERY_ROUTING_KEY)
                .build();
    }

    public String retryQueueName(int delaySeconds) {
        return properties.getQueue().getRetryPrefix() + delaySeconds + "s";
    }

    public List<String> retryQueueNames() {
        List<String> names = new ArrayList<>();
        for (Integer delay : properties.getRetry().getDelaysSeconds()) {
            names.add(retryQueueName(delay));
        }
        return names;
    }

    /**
     * 全部交换机、队列和绑定
     */
    public Declarables declarables() {
        TopicExchange mainExchange = mainExchange();
        TopicExchange deadLetterExchange = deadLetterExchange();
        Queue processingQueue = processingQueue();
        Queue failedQueue = failedQueue();

        List<Declarable> declarables = new ArrayList<>();
        declarables.add(mainExchange);
        declarables.add(deadLetterExchange);
        declarables.add(processingQueue);
        declarables.add(failedQueue);
        declarables.add(BindingBuilder.bind(processingQueue).to(mainExchange).with(PROCESSING_BINDING_PATTERN));
        declarables.add(BindingBuilder.bind(failedQueue).to(deadLetterExchange).with(FAILED_BINDING_PATTERN));
        for (Integer delay : properties.getRetry().getDelaysSeconds()) {
            declarables.add(retryQueue(delay));
        }
        return new Declarables(declarables);
    }

    /**
     * 显式声明全部拓扑（脚本、测试使用）
     */
    public void provision(AmqpAdmin amqpAdmin) {
        for (Declarable declarable : declarables().getDeclarables()) {
            if (declarable instanceof TopicExchange) {
                TopicExchange exchange = (TopicExchange) declarable;
                amqpAdmin.declareExchange(exchange);
                log.info("[交换机已声明] exchange={}", exchange.getName());
            } else if (declarable instanceof Queue) {
                Queue queue = (Queue) declarable;
                amqpAdmin.declareQueue(queue);
                log.info("[队列已声明] queue={}, arguments={}", queue.getName(), queue.getArguments());
            } else if (declarable instanceof Binding) {
                Binding binding = (Binding) declarable;
                amqpAdmin.declareBinding(binding);
                log.info("[绑定已声明] destination={}, exchange={}, routingKey={}",
                        binding.getDestination(), binding.getExchange(), binding.getRoutingKey());
            }
        }
        log.info("[重试拓扑声明完成] retryQueues={}", retryQueueNames());
    }
}
