package org.healthdata.mq.exception;

/**
 * 去重台账（Redis）不可用
 * - 当前投递NACK并重新入队，绝不跳过去重检查
 */
public class LedgerUnavailableException extends HealthQueueException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
