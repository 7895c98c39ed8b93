package org.codesync.client;

import org.codesync.sync.dto.ManifestEntry;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 客户端缓存的已提交视图：版本 + 路径 -> 清单条目。
 */
public record WorkspaceSnapshot(long version, Map<String, ManifestEntry> entries) {

    public WorkspaceSnapshot {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }
}
