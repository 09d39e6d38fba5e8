package org.healthdata.mq.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 处理优先级
 * - 只影响处理路由键的最后一段
 */
public enum ProcessingPriority {

    NORMAL("normal"),
    HIGH("high");

    private final String token;

    ProcessingPriority(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    @JsonCreator
    public static ProcessingPriority fromToken(String token) {
        if (token == null || token.isBlank()) {
            return NORMAL;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (ProcessingPriority priority : values()) {
            if (priority.token.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("未知的处理优先级: " + token);
    }
}
