package org.healthdata.mq.exception;

/**
 * 消息队列处理异常基类
 */
public class HealthQueueException extends RuntimeException {

    public HealthQueueException(String message) {
        super(message);
    }

    public HealthQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
