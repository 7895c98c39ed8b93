package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 服务端在第一阶段（sync）为每个路径下发的处理要求。
 */
public enum RequiredAction {
    UPLOAD("upload"),
    DELETE("delete"),
    NONE("none");

    private final String value;

    RequiredAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RequiredAction of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RequiredAction candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 RequiredAction 取值：" + value);
    }
}
