package org.healthdata.mq.controller;

import lombok.extern.slf4j.Slf4j;
import org.healthdata.mq.domain.LedgerRecord;
import org.healthdata.mq.exception.LedgerUnavailableException;
import org.healthdata.mq.service.IDeduplicationLedger;
import org.healthdata.mq.util.TraceIdUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 去重台账诊断接口
 * - 按幂等键查询处理状态、失败原因、剩余TTL
 * - 只读，不提供修改台账的入口
 */
@Slf4j
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final IDeduplicationLedger deduplicationLedger;

    public LedgerController(IDeduplicationLedger deduplicationLedger) {
        this.deduplicationLedger = deduplicationLedger;
    }

    /**
     * 台账记录查询API
     *
     * @param idempotencyKey 幂等键
     * @return 台账记录，不存在时404
     */
    @GetMapping("/{idempotencyKey}")
    public ResponseEntity<Map<String, Object>> getRecord(@PathVariable String idempotencyKey) {
        String traceId = TraceIdUtil.getTraceId();

        Map<String, Object> response = new HashMap<>();
        response.put("traceId", traceId);

        try {
            log.info("[台账查询请求] idempotencyKey={}, traceId={}", idempotencyKey, traceId);

            Optional<LedgerRecord> record = deduplicationLedger.getRecord(idempotencyKey);
            if (record.isEmpty()) {
                response.put("code", "NOT_FOUND");
                response.put("message", "台账记录不存在或已过期");
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }

            LedgerRecord ledgerRecord = record.get();
            Map<String, Object> data = new HashMap<>();
            data.put("idempotencyKey", ledgerRecord.getIdempotencyKey());
            data.put("status", ledgerRecord.getStatus() != null ? ledgerRecord.getStatus().getToken() : null);
            data.put("messageId", ledgerRecord.getMessageId());
            data.put("recordType", ledgerRecord.getRecordType());
            data.put("startedAt", ledgerRecord.getStartedAt());
            data.put("completedAt", ledgerRecord.getCompletedAt());
            data.put("failedAt", ledgerRecord.getFailedAt());
            data.put("durationSeconds", ledgerRecord.getDurationSeconds());
            data.put("error", ledgerRecord.getError());
            data.put("ttlSeconds", deduplicationLedger.getRemainingTtl(idempotencyKey)
                    .map(Duration::getSeconds)
                    .orElse(null));

            response.put("code", "SUCCESS");
            response.put("data", data);
            return ResponseEntity.ok(response);

        } catch (LedgerUnavailableException e) {
            log.error("[台账查询异常] idempotencyKey={}, errorMsg={}, traceId={}",
                    idempotencyKey, e.getMessage(), traceId);
            response.put("code", "LEDGER_UNAVAILABLE");
            response.put("message", "去重台账不可用：" + e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
