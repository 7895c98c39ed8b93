package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 客户端差异计算得出的单个路径变更类型。
 */
public enum ChangeAction {
    NEW("new"),
    MODIFIED("modified"),
    DELETED("deleted");

    private final String value;

    ChangeAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChangeAction of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ChangeAction candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 ChangeAction 取值：" + value);
    }
}
