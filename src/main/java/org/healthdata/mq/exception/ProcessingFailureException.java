package org.healthdata.mq.exception;

import lombok.Getter;

/**
 * 处理回调返回false或抛出异常
 * - 视为瞬时失败，走延迟重试
 */
@Getter
public class ProcessingFailureException extends HealthQueueException {

    private final String idempotencyKey;

    public ProcessingFailureException(String idempotencyKey, String message) {
        super(message);
        this.idempotencyKey = idempotencyKey;
    }

    public ProcessingFailureException(String idempotencyKey, String message, Throwable cause) {
        super(message, cause);
        this.idempotencyKey = idempotencyKey;
    }
}
