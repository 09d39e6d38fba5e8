package org.healthdata.mq.exception;

/**
 * 消息体无法解析或缺少必填字段
 * - 直接进入死信，不重试
 */
public class MalformedMessageException extends HealthQueueException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
