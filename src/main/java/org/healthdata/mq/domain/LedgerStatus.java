package org.healthdata.mq.domain;

/**
 * 去重台账状态
 * - 不存在（absent）用 Optional.empty() 表示，不是一个存储值
 * - PROCESSING、COMPLETED 视为重复；FAILED 允许重试
 */
public enum LedgerStatus {

    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String token;

    LedgerStatus(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * 该状态是否会拦截后续投递
     */
    public boolean blocksRedelivery() {
        return this == PROCESSING || this == COMPLETED;
    }

    /**
     * 解析Redis中的状态值，未知值返回null
     */
    public static LedgerStatus fromToken(String token) {
        if (token == null) {
            return null;
        }
        for (LedgerStatus status : values()) {
            if (status.token.equals(token)) {
                return status;
            }
        }
        return null;
    }
}
