package org.healthdata.mq.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 去重台账记录（Redis Hash）
 * - status 决定去重行为
 * - 其余字段仅用于诊断，不影响处理逻辑
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerRecord {

    public static final String FIELD_STATUS = "status";
    public static final String FIELD_MESSAGE_ID = "message_id";
    public static final String FIELD_RECORD_TYPE = "record_type";
    public static final String FIELD_STARTED_AT = "started_at";
    public static final String FIELD_COMPLETED_AT = "completed_at";
    public static final String FIELD_FAILED_AT = "failed_at";
    public static final String FIELD_DURATION_SECONDS = "duration_seconds";
    public static final String FIELD_ERROR = "error";

    /**
     * 幂等键
     */
    private String idempotencyKey;

    /**
     * 当前状态
     */
    private LedgerStatus status;

    private String messageId;

    private String recordType;

    /**
     * 开始处理时间（ISO-8601）
     */
    private String startedAt;

    private String completedAt;

    private String failedAt;

    /**
     * 处理耗时（秒）
     */
    private Double durationSeconds;

    /**
     * 最近一次失败原因
     */
    private String error;

    /**
     * 从Redis Hash构建记录
     */
    public static LedgerRecord fromHash(String idempotencyKey, Map<?, ?> hash) {
        String duration = asString(hash.get(FIELD_DURATION_SECONDS));
        return LedgerRecord.builder()
                .idempotencyKey(idempotencyKey)
                .status(LedgerStatus.fromToken(asString(hash.get(FIELD_STATUS))))
                .messageId(asString(hash.get(FIELD_MESSAGE_ID)))
                .recordType(asString(hash.get(FIELD_RECORD_TYPE)))
                .startedAt(asString(hash.get(FIELD_STARTED_AT)))
                .completedAt(asString(hash.get(FIELD_COMPLETED_AT)))
                .failedAt(asString(hash.get(FIELD_FAILED_AT)))
                .durationSeconds(duration != null && !duration.isEmpty() ? Double.valueOf(duration) : null)
                .error(asString(hash.get(FIELD_ERROR)))
                .build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
