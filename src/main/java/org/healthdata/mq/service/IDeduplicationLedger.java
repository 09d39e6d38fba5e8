package org.healthdata.mq.service;

import org.healthdata.mq.domain.HealthDataMessage;
import org.healthdata.mq.domain.LedgerRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * 去重台账接口
 * - 每个幂等键三种状态：processing、completed、failed（不存在即absent）
 * - 所有写入都带TTL，记录自动过期
 * - 存储不可达时所有方法抛出 LedgerUnavailableException
 */
public interface IDeduplicationLedger {

    /**
     * 是否已处理（processing 或 completed 返回true；absent、failed 返回false）
     *
     * @param idempotencyKey 幂等键
     */
    boolean isAlreadyProcessed(String idempotencyKey);

    /**
     * 原子地占用幂等键：当前为processing/completed时返回false，否则写入processing并返回true
     *
     * @param message 待处理消息
     */
    boolean tryClaim(HealthDataMessage message);

    /**
     * 标记开始处理，每次处理尝试调用一次，在回调之前
     *
     * @param message 待处理消息
     */
    void markProcessingStarted(HealthDataMessage message);

    /**
     * 标记处理成功，TTL刷新为完整保留窗口
     *
     * @param idempotencyKey 幂等键
     * @param duration 处理耗时
     */
    void markProcessingCompleted(String idempotencyKey, Duration duration);

    /**
     * 标记处理失败，failed不拦截后续重试
     *
     * @param idempotencyKey 幂等键
     * @param error 失败原因
     */
    void markProcessingFailed(String idempotencyKey, String error);

    /**
     * 清理过期记录：由存储自身的TTL完成，这里不做任何事
     */
    void cleanupOldRecords();

    /**
     * 查询诊断信息
     */
    Optional<LedgerRecord> getRecord(String idempotencyKey);

    /**
     * 查询剩余TTL，不存在或无过期时间时返回empty
     */
    Optional<Duration> getRemainingTtl(String idempotencyKey);

    /**
     * 存储是否可达
     */
    boolean ping();
}
