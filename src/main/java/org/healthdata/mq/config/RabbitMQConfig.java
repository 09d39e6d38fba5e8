package org.healthdata.mq.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 主交换机、死信交换机、主处理队列、失败队列、各延迟重试队列（由 RetryTopology 生成）
 * - Declarables 交给 RabbitAdmin 在每次建立连接时幂等声明
 * - RabbitTemplate 开启 mandatory，发布确认与退回通过 CorrelationData 回传给发布器
 */
@Slf4j
@Configuration
public class RabbitMQConfig {

    @Bean
    public RetryTopology retryTopology(MessageQueueProperties properties) {
        return new RetryTopology(properties);
    }

    // ==================== 交换机、队列、绑定 ====================

    @Bean
    public Declarables healthDataTopology(RetryTopology retryTopology) {
        return retryTopology.declarables();
    }

    // ==================== RabbitTemplate 配置 ====================

    /**
     * 配置RabbitTemplate以支持消息确认和回调
     * - 结果由 CorrelationData 的 future 交给发布器判断，这里只记录日志
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMandatory(true);
        // 设置发送者确认回调
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.warn("[发布确认失败] correlationId={}, cause={}",
                        correlationData != null ? correlationData.getId() : null, cause);
            }
        });
        // 设置消息退回回调（无队列绑定）
        rabbitTemplate.setReturnsCallback(returned ->
                log.warn("[消息被退回] exchange={}, routingKey={}, replyCode={}, replyText={}",
                        returned.getExchange(), returned.getRoutingKey(),
                        returned.getReplyCode(), returned.getReplyText()));
        return rabbitTemplate;
    }
}
