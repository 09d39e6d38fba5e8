package org.healthdata.mq.processor;

import org.healthdata.mq.domain.HealthDataMessage;

/**
 * 消息处理回调，由消费者在每次处理尝试中调用一次
 */
@FunctionalInterface
public interface MessageProcessor {

    /**
     * @param message 已反序列化的消息
     * @return true表示处理成功；false或抛出异常都进入重试路径
     */
    boolean process(HealthDataMessage message) throws Exception;
}
