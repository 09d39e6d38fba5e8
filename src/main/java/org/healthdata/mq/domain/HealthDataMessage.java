package org.healthdata.mq.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 健康数据处理消息
 * - 描述一个待处理的上传文件（一个工作单元）
 * - 幂等键为去重单位：值为空或null时由 userId + contentHash + uploadTimestampUtc 推导，序列化往返不会改变
 * - JSON中必须出现 idempotency_key 字段，缺失视为畸形消息
 * - 构造后除 retryCount 外不可变，retryCount 只能通过 incrementRetry 修改
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthDataMessage {

    public static final int IDEMPOTENCY_KEY_LENGTH = 16;

    public static final List<Integer> DEFAULT_RETRY_DELAYS_SECONDS = List.of(30, 300, 900);

    private static final String PROCESSING_ROUTING_PREFIX = "health.processing.";
    private static final String RETRY_ROUTING_PREFIX = "health.retry.";

    /**
     * 消息ID（仅用于追踪）
     */
    private final String messageId;

    /**
     * 关联ID（仅用于追踪）
     */
    private final String correlationId;

    private final String userId;

    private final String bucket;

    /**
     * 对象存储中的文件key
     */
    private final String key;

    /**
     * 文件内容SHA256
     */
    private final String contentHash;

    private final long fileSizeBytes;

    private final Integer recordCount;

    /**
     * 记录类型：BloodGlucose、HeartRate等，决定下游处理器
     */
    private final String recordType;

    /**
     * 上传时间（ISO-8601）
     */
    private final String uploadTimestampUtc;

    private final String idempotencyKey;

    @With
    private final ProcessingPriority processingPriority;

    private int retryCount;

    /**
     * 附加的健康数据元信息，原样透传
     */
    private final Map<String, Object> healthMetadata;

    @Builder(toBuilder = true)
    @JsonCreator
    public HealthDataMessage(@JsonProperty("message_id") String messageId,
                             @JsonProperty("correlation_id") String correlationId,
                             @JsonProperty("user_id") String userId,
                             @JsonProperty("bucket") String bucket,
                             @JsonProperty("key") String key,
                             @JsonProperty("content_hash") String contentHash,
                             @JsonProperty("file_size_bytes") Long fileSizeBytes,
                             @JsonProperty("record_count") Integer recordCount,
                             @JsonProperty("record_type") String recordType,
                             @JsonProperty("upload_timestamp_utc") String uploadTimestampUtc,
                             @JsonProperty(value = "idempotency_key", required = true) String idempotencyKey,
                             @JsonProperty("processing_priority") ProcessingPriority processingPriority,
                             @JsonProperty("retry_count") Integer retryCount,
                             @JsonProperty("health_metadata") Map<String, Object> healthMetadata) {
        this.messageId = requireText(messageId, "message_id");
        this.correlationId = requireText(correlationId, "correlation_id");
        this.userId = requireText(userId, "user_id");
        this.bucket = requireText(bucket, "bucket");
        this.key = requireText(key, "key");
        this.contentHash = requireText(contentHash, "content_hash");
        if (fileSizeBytes == null) {
            throw new IllegalArgumentException("缺少必填字段: file_size_bytes");
        }
        this.fileSizeBytes = fileSizeBytes;
        this.recordCount = recordCount;
        this.recordType = requireText(recordType, "record_type");
        this.uploadTimestampUtc = requireText(uploadTimestampUtc, "upload_timestamp_utc");
        this.idempotencyKey = (idempotencyKey == null || idempotencyKey.isEmpty())
                ? generateIdempotencyKey(this.userId, this.contentHash, this.uploadTimestampUtc)
                : idempotencyKey;
        this.processingPriority = processingPriority != null ? processingPriority : ProcessingPriority.NORMAL;
        int count = retryCount != null ? retryCount : 0;
        if (count < 0) {
            throw new IllegalArgumentException("retry_count 不能为负数: " + count);
        }
        this.retryCount = count;
        this.healthMetadata = healthMetadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(healthMetadata))
                : null;
    }

    /**
     * 处理路由键：health.processing.{recordType小写}.{priority}
     */
    public String routingKey() {
        return PROCESSING_ROUTING_PREFIX + recordType.toLowerCase(Locale.ROOT) + "." + processingPriority.getToken();
    }

    /**
     * 重试路由键：health.retry.{recordType小写}.attempt_{retryCount}
     */
    public String retryRoutingKey() {
        return RETRY_ROUTING_PREFIX + recordType.toLowerCase(Locale.ROOT) + ".attempt_" + retryCount;
    }

    /**
     * 重试次数加一，上限由消费者控制
     */
    public HealthDataMessage incrementRetry() {
        this.retryCount += 1;
        return this;
    }

    public int retryDelaySeconds() {
        return retryDelaySeconds(DEFAULT_RETRY_DELAYS_SECONDS);
    }

    /**
     * 按retryCount（从1开始）取延迟，超出长度时取最后一个，不会越界
     *
     * @param schedule 升序的延迟表（秒）
     */
    public int retryDelaySeconds(List<Integer> schedule) {
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalStateException("重试延迟表不能为空");
        }
        int index = Math.min(Math.max(retryCount - 1, 0), schedule.size() - 1);
        return schedule.get(index);
    }

    /**
     * 生成幂等键：SHA256(userId:contentHash:uploadTimestampUtc) 的前16位
     */
    public static String generateIdempotencyKey(String userId, String contentHash, String uploadTimestampUtc) {
        String input = userId + ":" + contentHash + ":" + uploadTimestampUtc;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, IDEMPOTENCY_KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM不支持SHA-256", e);
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("缺少必填字段: " + field);
        }
        return value;
    }
}
