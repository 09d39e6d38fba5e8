package org.healthdata.mq.exception;

/**
 * 没有为该记录类型注册处理器
 */
public class UnsupportedRecordTypeException extends HealthQueueException {

    public UnsupportedRecordTypeException(String recordType) {
        super("不支持的记录类型: " + recordType);
    }
}
