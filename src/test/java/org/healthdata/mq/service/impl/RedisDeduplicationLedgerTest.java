package org.healthdata.mq.service.impl;

import org.healthdata.mq.config.MessageQueuePropertiesFixture;
import org.healthdata.mq.domain.HealthDataMessageFixture;
import org.healthdata.mq.domain.LedgerRecord;
import org.healthdata.mq.domain.LedgerStatus;
import org.healthdata.mq.exception.LedgerUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDeduplicationLedgerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    private RedisDeduplicationLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new RedisDeduplicationLedger(redisTemplate, MessageQueuePropertiesFixture.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("processing/completed 视为已处理，failed/不存在 视为未处理")
    void isAlreadyProcessedByStatus() {
        doReturn(hashOperations).when(redisTemplate).opsForHash();
        when(hashOperations.get("health:dedup:p", "status")).thenReturn("processing");
        when(hashOperations.get("health:dedup:c", "status")).thenReturn("completed");
        when(hashOperations.get("health:dedup:f", "status")).thenReturn("failed");
        when(hashOperations.get("health:dedup:a", "status")).thenReturn(null);

        assertThat(ledger.isAlreadyProcessed("p")).isTrue();
        assertThat(ledger.isAlreadyProcessed("c")).isTrue();
        assertThat(ledger.isAlreadyProcessed("f")).isFalse();
        assertThat(ledger.isAlreadyProcessed("a")).isFalse();
    }

    @Test
    @DisplayName("Redis不可达时抛出 LedgerUnavailableException")
    void redisFailureTranslated() {
        doReturn(hashOperations).when(redisTemplate).opsForHash();
        when(hashOperations.get("health:dedup:k", "status"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> ledger.isAlreadyProcessed("k"))
                .isInstanceOf(LedgerUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    @DisplayName("标记完成：TTL为保留窗口，写入状态、完成时间、耗时")
    void markCompletedWritesRetentionTtl() {
        List<Object> captured = new ArrayList<>();
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenAnswer(invocation -> {
                    captured.add(invocation.getArgument(1));
                    captured.addAll(Arrays.asList(invocation.getArguments()).subList(2, invocation.getArguments().length));
                    return 1L;
                });

        ledger.markProcessingCompleted("k", Duration.ofMillis(1500));

        assertThat(captured).containsExactly(
                List.of("health:dedup:k"),
                String.valueOf(72 * 3600),
                "status", "completed",
                "completed_at", "2024-01-15T10:30:00Z",
                "duration_seconds", "1.5");
    }

    @Test
    @DisplayName("标记完成：脚本先删除之前失败留下的error和failed_at")
    void markCompletedClearsFailureFields() {
        List<RedisScript<?>> scripts = new ArrayList<>();
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenAnswer(invocation -> {
                    scripts.add(invocation.getArgument(0));
                    return 1L;
                });

        ledger.markProcessingFailed("k", "下游超时");
        ledger.markProcessingCompleted("k", Duration.ofMillis(10));

        assertThat(scripts.get(0).getScriptAsString()).doesNotContain("HDEL");
        assertThat(scripts.get(1).getScriptAsString()).contains("'HDEL', KEYS[1], 'error', 'failed_at'");
    }

    @Test
    @DisplayName("标记开始：写入processing和诊断字段")
    void markStartedWritesProcessing() {
        List<Object> captured = new ArrayList<>();
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenAnswer(invocation -> {
                    captured.addAll(Arrays.asList(invocation.getArguments()).subList(2, invocation.getArguments().length));
                    return 1L;
                });

        ledger.markProcessingStarted(HealthDataMessageFixture.withKey("k"));

        assertThat(captured).containsExactly(
                String.valueOf(72 * 3600),
                "status", "processing",
                "message_id", "msg-001",
                "record_type", "BloodGlucose",
                "started_at", "2024-01-15T10:30:00Z");
    }

    @Test
    @DisplayName("标记失败：超长错误信息被截断")
    void markFailedTruncatesError() {
        List<Object> captured = new ArrayList<>();
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenAnswer(invocation -> {
                    captured.addAll(Arrays.asList(invocation.getArguments()).subList(2, invocation.getArguments().length));
                    return 1L;
                });

        ledger.markProcessingFailed("k", "x".repeat(5000));

        assertThat(captured).contains("status", "failed", "failed_at");
        assertThat((String) captured.get(captured.size() - 1)).hasSize(1000);
    }

    @Test
    @DisplayName("原子占用：脚本返回0表示已被占用")
    void tryClaimReflectsScriptResult() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenReturn(1L, 0L);

        assertThat(ledger.tryClaim(HealthDataMessageFixture.withKey("k"))).isTrue();
        assertThat(ledger.tryClaim(HealthDataMessageFixture.withKey("k"))).isFalse();
    }

    @Test
    @DisplayName("查询记录和剩余TTL")
    void recordAndTtl() {
        doReturn(hashOperations).when(redisTemplate).opsForHash();
        when(hashOperations.entries("health:dedup:k")).thenReturn(Map.of(
                "status", "completed",
                "message_id", "msg-001",
                "duration_seconds", "0.25"));
        when(hashOperations.entries("health:dedup:missing")).thenReturn(Map.of());
        when(redisTemplate.getExpire("health:dedup:k", TimeUnit.SECONDS)).thenReturn(3600L);
        when(redisTemplate.getExpire("health:dedup:missing", TimeUnit.SECONDS)).thenReturn(-2L);

        Optional<LedgerRecord> record = ledger.getRecord("k");

        assertThat(record).isPresent();
        assertThat(record.get().getStatus()).isEqualTo(LedgerStatus.COMPLETED);
        assertThat(record.get().getMessageId()).isEqualTo("msg-001");
        assertThat(record.get().getDurationSeconds()).isEqualTo(0.25);
        assertThat(ledger.getRecord("missing")).isEmpty();
        assertThat(ledger.getRemainingTtl("k")).contains(Duration.ofHours(1));
        assertThat(ledger.getRemainingTtl("missing")).isEmpty();
    }

    @Test
    @DisplayName("ping：PONG为可达，异常为不可达")
    @SuppressWarnings("unchecked")
    void ping() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenReturn("PONG")
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(ledger.ping()).isTrue();
        assertThat(ledger.ping()).isFalse();
    }
}
