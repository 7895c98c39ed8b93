package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 清单条目类型：普通文件或目录（目录没有内容哈希/大小/存储键）。
 */
public enum EntryKind {
    FILE("file"),
    FOLDER("folder");

    private final String value;

    EntryKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EntryKind of(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntryKind candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("未知的 EntryKind 取值：" + value);
    }
}
