package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * confirm 阶段冲突的具体原因（用于区分“预留过期”与“被并发提交抢先”）。
 */
public enum ConflictReason {
    UNKNOWN_RESERVATION("unknown_reservation"),
    ALREADY_COMMITTED("already_committed"),
    RESERVATION_EXPIRED("reservation_expired"),
    SUPERSEDED("superseded");

    private final String value;

    ConflictReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConflictReason of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConflictReason candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 ConflictReason 取值：" + value);
    }
}
