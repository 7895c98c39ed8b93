package org.codesync.client;

import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.WorkspaceManifest;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 客户端最后一次确认的清单与版本。
 * <p>
 * 只有两种更新方式：整体重新加载（{@link #reload}），或在 confirm 成功后应用已提交的动作（{@link #applyCommitted}）。
 * 失败的轮次不会改动缓存。
 */
public class LocalWorkspaceCache {

    private final AtomicReference<WorkspaceSnapshot> snapshot = new AtomicReference<>();
    private final Clock clock;

    public LocalWorkspaceCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<WorkspaceSnapshot> snapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }

    public WorkspaceSnapshot reload(WorkspaceManifest manifest) {
        Map<String, ManifestEntry> entries = new HashMap<>();
        if (manifest.manifest() != null) {
            for (ManifestEntry entry : manifest.manifest()) {
                // 下载地址只在拉取时有效，不放进缓存
                entries.put(entry.filePath(), entry.withDownloadUrl(null));
            }
        }
        WorkspaceSnapshot loaded = new WorkspaceSnapshot(manifest.workspaceVersion(), entries);
        snapshot.set(loaded);
        return loaded;
    }

    public WorkspaceSnapshot applyCommitted(ConfirmedSync confirmed) {
        WorkspaceSnapshot current = snapshot.get();
        if (current == null) {
            throw new IllegalStateException("本地缓存尚未加载");
        }
        Instant now = clock.instant();
        Map<String, ManifestEntry> entries = new TreeMap<>(current.entries());
        for (FileAction action : confirmed.actions()) {
            if (action.action() == ConfirmAction.DELETE) {
                entries.remove(action.filePath());
                continue;
            }
            ManifestEntry previous = entries.get(action.filePath());
            Instant createdAt = previous == null ? now : previous.createdAt();
            ManifestEntry next = action.kind() == EntryKind.FOLDER
                    ? new ManifestEntry(action.filePath(), action.fileId(), null, EntryKind.FOLDER, null, null, createdAt, now, null)
                    : new ManifestEntry(action.filePath(), action.fileId(), action.storageKey(), EntryKind.FILE,
                    action.clientHash(), action.size(), createdAt, now, null);
            entries.put(action.filePath(), next);
        }
        WorkspaceSnapshot updated = new WorkspaceSnapshot(confirmed.version(), entries);
        snapshot.set(updated);
        return updated;
    }
}
