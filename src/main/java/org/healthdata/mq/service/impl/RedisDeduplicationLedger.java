package org.healthdata.mq.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.config.MessageQueueProperties;
import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.domain.LedgerRecord;
import org.healthdata.mq.domain.LedgerStatus;
import org.healthdata.mq.exception.LedgerUnavailableException;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于Redis的去重台账
 * - 每个幂等键一个Hash：status + 诊断字段
 * - 写操作用Lua脚本，HSET和EXPIRE在同一次调用中原子完成
 * - 生命周期完全交给Redis TTL，不存在显式删除
 */
@Slf4j
@Service
public class RedisDeduplicationLedger implements IDeduplicationLedger {

    /**
     * ARGV[1]=TTL秒数，其余为 field/value 对
     */
    private static final String WRITE_SCRIPT =
            "redis.call('HSET', KEYS[1], unpack(ARGV, 2))\n" +
                    "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))\n" +
                    "return 1";

    /**
     * processing/completed 时拒绝占用，absent/failed 时写入processing
     */
    private static final String CLAIM_SCRIPT =
            "local status = redis.call('HGET', KEYS[1], 'status')\n" +
                    "if status == 'processing' or status == 'completed' then\n" +
                    "    return 0\n" +
                    "end\n" +
                    "redis.call('HSET', KEYS[1], unpack(ARGV, 2))\n" +
                    "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))\n" +
                    "return 1";

    /**
     * 完成时清除之前失败尝试留下的 error/failed_at
     */
    private static final String COMPLETE_SCRIPT =
            "redis.call('HDEL', KEYS[1], '" + LedgerRecord.FIELD_ERROR + "', '" + LedgerRecord.FIELD_FAILED_AT + "')\n" +
                    WRITE_SCRIPT;

    private static final RedisScript<Long> WRITE = new DefaultRedisScript<>(WRITE_SCRIPT, Long.class);
    private static final RedisScript<Long> COMPLETE = new DefaultRedisScript<>(COMPLETE_SCRIPT, Long.class);
    private static final RedisScript<Long> CLAIM = new DefaultRedisScript<>(CLAIM_SCRIPT, Long.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private final StringRedisTemplate redisTemplate;
    private final MessageQueueProperties.Dedup dedup;
    private final Clock clock;

    @Autowired
    public RedisDeduplicationLedger(StringRedisTemplate redisTemplate, MessageQueueProperties properties) {
        this(redisTemplate, properties, Clock.systemUTC());
    }

    public RedisDeduplicationLedger(StringRedisTemplate redisTemplate, MessageQueueProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.dedup = properties.getDedup();
        this.clock = clock;
    }

    @Override
    public boolean isAlreadyProcessed(String idempotencyKey) {
        Object token = execute("isAlreadyProcessed", idempotencyKey,
                () -> redisTemplate.opsForHash().get(buildKey(idempotencyKey), LedgerRecord.FIELD_STATUS));
        LedgerStatus status = LedgerStatus.fromToken(token != null ? token.toString() : null);
        return status != null && status.blocksRedelivery();
    }

    @Override
    public boolean tryClaim(HealthDataMessage message) {
        List<String> args = startedArgs(message);
        Long claimed = execute("tryClaim", message.getIdempotencyKey(),
                () -> redisTemplate.execute(CLAIM, Collections.singletonList(buildKey(message.getIdempotencyKey())),
                        args.toArray()));
        boolean success = claimed != null && claimed == 1L;
        log.debug("[幂等占用] idempotencyKey={}, claimed={}", message.getIdempotencyKey(), success);
        return success;
    }

    @Override
    public void markProcessingStarted(HealthDataMessage message) {
        write("markProcessingStarted", WRITE, message.getIdempotencyKey(), startedArgs(message));
        log.debug("[台账-开始处理] idempotencyKey={}, messageId={}", message.getIdempotencyKey(), message.getMessageId());
    }

    @Override
    public void markProcessingCompleted(String idempotencyKey, Duration duration) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(dedup.getRetention().getSeconds()));
        addField(args, LedgerRecord.FIELD_STATUS, LedgerStatus.COMPLETED.getToken());
        addField(args, LedgerRecord.FIELD_COMPLETED_AT, now());
        addField(args, LedgerRecord.FIELD_DURATION_SECONDS, String.valueOf(duration.toMillis() / 1000.0));
        write("markProcessingCompleted", COMPLETE, idempotencyKey, args);
        log.debug("[台账-处理完成] idempotencyKey={}, duration={}ms", idempotencyKey, duration.toMillis());
    }

    @Override
    public void markProcessingFailed(String idempotencyKey, String error) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(dedup.getFailedRetention().getSeconds()));
        addField(args, LedgerRecord.FIELD_STATUS, LedgerStatus.FAILED.getToken());
        addField(args, LedgerRecord.FIELD_FAILED_AT, now());
        addField(args, LedgerRecord.FIELD_ERROR, truncate(error));
        write("markProcessingFailed", WRITE, idempotencyKey, args);
        log.debug("[台账-处理失败] idempotencyKey={}, error={}", idempotencyKey, error);
    }

    @Override
    public void cleanupOldRecords() {
        log.debug("[台账清理] 由Redis TTL自动过期，无需处理");
    }

    @Override
    public Optional<LedgerRecord> getRecord(String idempotencyKey) {
        Map<Object, Object> hash = execute("getRecord", idempotencyKey,
                () -> redisTemplate.opsForHash().entries(buildKey(idempotencyKey)));
        if (hash == null || hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LedgerRecord.fromHash(idempotencyKey, hash));
    }

    @Override
    public Optional<Duration> getRemainingTtl(String idempotencyKey) {
        Long seconds = execute("getRemainingTtl", idempotencyKey,
                () -> redisTemplate.getExpire(buildKey(idempotencyKey), TimeUnit.SECONDS));
        // -2: key不存在，-1: 没有过期时间
        if (seconds == null || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(seconds));
    }

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("[台账不可达] errorMsg={}", e.getMessage());
            return false;
        }
    }

    private List<String> startedArgs(HealthDataMessage message) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(dedup.getProcessingTtl().getSeconds()));
        addField(args, LedgerRecord.FIELD_STATUS, LedgerStatus.PROCESSING.getToken());
        addField(args, LedgerRecord.FIELD_MESSAGE_ID, message.getMessageId());
        addField(args, LedgerRecord.FIELD_RECORD_TYPE, message.getRecordType());
        addField(args, LedgerRecord.FIELD_STARTED_AT, now());
        return args;
    }

    private void write(String operation, RedisScript<Long> script, String idempotencyKey, List<String> args) {
        execute(operation, idempotencyKey,
                () -> redisTemplate.execute(script, Collections.singletonList(buildKey(idempotencyKey)), args.toArray()));
    }

    private <T> T execute(String operation, String idempotencyKey, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[台账不可达] operation={}, idempotencyKey={}, errorMsg={}", operation, idempotencyKey, e.getMessage());
            throw new LedgerUnavailableException("去重台账不可用: " + operation, e);
        }
    }

    private static void addField(List<String> args, String field, String value) {
        args.add(field);
        args.add(value != null ? value : "");
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static String truncate(String error) {
        if (error == null) {
            return "";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    /**
     * 构建台账Key
     */
    private String buildKey(String idempotencyKey) {
        return dedup.getKeyPrefix() + idempotencyKey;
    }
}
