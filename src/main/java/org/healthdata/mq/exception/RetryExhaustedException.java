package org.healthdata.mq.exception;

import lombok.Getter;

/**
 * 重试次数已用尽，消息转入永久失败队列
 */
@Getter
public class RetryExhaustedException extends HealthQueueException {

    private final String idempotencyKey;
    private final int retryCount;
    private final int maxRetries;

    public RetryExhaustedException(String idempotencyKey, int retryCount, int maxRetries, Throwable cause) {
        super("超过最大重试次数: idempotencyKey=" + idempotencyKey
                + ", retryCount=" + retryCount + ", maxRetries=" + maxRetries, cause);
        this.idempotencyKey = idempotencyKey;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
    }
}
