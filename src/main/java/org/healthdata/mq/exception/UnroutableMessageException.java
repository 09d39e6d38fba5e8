package org.healthdata.mq.exception;

/**
 * mandatory发布被broker退回（没有队列绑定）
 * - 重试无意义，不重试
 */
public class UnroutableMessageException extends PublishFailureException {

    public UnroutableMessageException(String message) {
        super(message);
    }
}
