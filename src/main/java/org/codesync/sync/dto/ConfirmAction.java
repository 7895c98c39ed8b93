package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 第二阶段（confirm）中客户端最终确认的动作：上传对应 upsert，删除对应 delete。
 */
public enum ConfirmAction {
    UPSERT("upsert"),
    DELETE("delete");

    private final String value;

    ConfirmAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConfirmAction of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConfirmAction candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 ConfirmAction 取值：" + value);
    }
}
