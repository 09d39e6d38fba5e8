package org.healthdata.mq.task;

import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 去重台账维护定时任务
 * - 按 health.mq.dedup.cleanup-interval 周期调用 cleanupOldRecords
 * - Redis 台账依赖TTL自动过期，这里只是保留给其他存储实现的维护入口
 */
@Slf4j
@Component
@EnableScheduling
public class LedgerMaintenanceTask {

    private final IDeduplicationLedger deduplicationLedger;

    public LedgerMaintenanceTask(IDeduplicationLedger deduplicationLedger) {
        this.deduplicationLedger = deduplicationLedger;
    }

    @Scheduled(fixedDelayString = "${health.mq.dedup.cleanup-interval:PT1H}",
            initialDelayString = "${health.mq.dedup.cleanup-interval:PT1H}")
    public void cleanup() {
        try {
            log.debug("[台账维护任务] 开始执行");
            deduplicationLedger.cleanupOldRecords();
            log.debug("[台账维护任务] 执行完成");
        } catch (RuntimeException e) {
            log.error("[台账维护任务异常] errorMsg={}", e.getMessage(), e);
        }
    }
}
