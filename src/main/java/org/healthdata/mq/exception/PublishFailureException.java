package org.healthdata.mq.exception;

/**
 * 消息发布失败（broker nack、确认超时、连接异常）
 * - 发布器本地按指数退避重试，用尽后抛给调用方
 */
public class PublishFailureException extends HealthQueueException {

    public PublishFailureException(String message) {
        super(message);
    }

    public PublishFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
