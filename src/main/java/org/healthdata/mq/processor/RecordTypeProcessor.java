package org.healthdata.mq.processor;

import org.healthdata.mq.domain.HealthDataMessage;

/**
 * 按记录类型注册的处理器
 * - recordType 大小写不敏感，BloodGlucose 与 bloodglucose 视为同一类型
 */
public interface RecordTypeProcessor {

    String recordType();

    boolean process(HealthDataMessage message) throws Exception;
}
