package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 第二阶段（confirm）的返回状态。
 */
public enum ConfirmStatus {
    SUCCESS("success"),
    CONFLICT("conflict"),
    ERROR("error");

    private final String value;

    ConfirmStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConfirmStatus of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConfirmStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 ConfirmStatus 取值：" + value);
    }
}
