package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 第一阶段（sync）的返回状态。
 */
public enum SyncStatus {
    OK("ok"),
    NO_CHANGES("no_changes"),
    WORKSPACE_CONFLICT("workspace_conflict"),
    ERROR("error");

    private final String value;

    SyncStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SyncStatus of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SyncStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 SyncStatus 取值：" + value);
    }
}
