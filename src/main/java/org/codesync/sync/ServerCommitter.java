package org.codesync.sync;

import org.codesync.sync.Reservation.Committed;
import org.codesync.sync.Reservation.Pending;
import org.codesync.sync.Reservation.ReservedAction;
import org.codesync.sync.blob.BlobInfo;
import org.codesync.sync.blob.BlobStore;
import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.ConflictReason;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.store.CommitResult;
import org.codesync.sync.store.MetadataStore;
import org.codesync.sync.store.WorkspaceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 第二阶段（confirm / commit）。
 * <p>
 * 步骤：
 * <ol>
 *   <li>找到预留；未知、已提交、已过期、版本已被推进都以 conflict 返回，并携带当前版本。</li>
 *   <li>校验最终动作与预留的动作集合完全一致（路径、fileId、对象键、类型、哈希）；可选地校验对象存储中的实际内容。</li>
 *   <li>一次条件写入替换清单、版本恰好 +1，并把预留标记为已提交；条件写入失败即 superseded。</li>
 *   <li>持久化成功后删除不再被引用的对象；删除失败只记录日志，不影响提交结果。</li>
 * </ol>
 */
public class ServerCommitter {

    private static final Logger log = LoggerFactory.getLogger(ServerCommitter.class);

    private final MetadataStore metadataStore;
    private final SyncReservationStore reservations;
    private final BlobStore blobStore;
    private final boolean verifyUploads;
    private final Clock clock;

    public ServerCommitter(
            MetadataStore metadataStore,
            SyncReservationStore reservations,
            BlobStore blobStore,
            boolean verifyUploads,
            Clock clock
    ) {
        this.metadataStore = metadataStore;
        this.reservations = reservations;
        this.blobStore = blobStore;
        this.verifyUploads = verifyUploads;
        this.clock = clock;
    }

    public ConfirmSyncResponse confirm(String workspaceId, ConfirmSyncRequest request) {
        if (request == null || request.workspaceVersion() == null || request.syncActions() == null) {
            throw new SyncValidationException("confirm 请求必须携带 workspaceVersion 与 syncActions");
        }
        Map<String, FileAction> finalized = indexByPath(request.syncActions());
        WorkspaceRecord record = metadataStore.find(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));

        Optional<Reservation> found = request.reservationId() != null
                ? reservations.find(record, request.reservationId())
                : reservations.match(record, request.workspaceVersion(), finalized);
        if (found.isEmpty() || !found.get().workspaceId().equals(workspaceId)) {
            return conflict(workspaceId, ConflictReason.UNKNOWN_RESERVATION, record.version(), "预留不存在，请重新同步");
        }
        if (found.get() instanceof Committed committed) {
            return conflict(workspaceId, ConflictReason.ALREADY_COMMITTED, record.version(),
                    "该预留已在版本 " + committed.version() + " 提交");
        }

        Pending pending = (Pending) found.get();
        if (pending.provisionalVersion() != request.workspaceVersion()) {
            throw new SyncValidationException("confirm 版本与预留不一致：期望 " + pending.provisionalVersion()
                    + "，实际 " + request.workspaceVersion());
        }
        if (pending.isExpiredAt(clock.instant())) {
            return conflict(workspaceId, ConflictReason.RESERVATION_EXPIRED, record.version(), "预留已过期，请重新同步");
        }
        if (record.version() != pending.baseVersion()) {
            return conflict(workspaceId, ConflictReason.SUPERSEDED, record.version(), "工作区已被其他提交推进，请重新同步");
        }

        requireMatchesReservation(pending, finalized);
        if (verifyUploads) {
            verifyUploadedObjects(finalized.values());
        }

        CommitResult result;
        try {
            result = metadataStore.compareAndSet(workspaceId, pending.baseVersion(),
                    current -> reservations.markCommitted(apply(current, finalized.values(), clock.instant()), pending));
        } catch (VersionConflictException e) {
            // 并发确认：同一基准版本只有一个条件写入能成功
            Optional<Reservation> now = reservations.find(workspaceId, pending.reservationId());
            if (now.isPresent() && now.get() instanceof Committed) {
                return conflict(workspaceId, ConflictReason.ALREADY_COMMITTED, e.getCurrentVersion(), "该预留已被提交");
            }
            return conflict(workspaceId, ConflictReason.SUPERSEDED, e.getCurrentVersion(), "工作区已被其他提交推进，请重新同步");
        }

        long newVersion = result.current().version();
        deleteUnreferencedObjects(result, finalized.values());
        log.info("confirm 成功：workspace={}，版本 {} -> {}，动作 {} 个",
                workspaceId, result.previous().version(), newVersion, finalized.size());
        return ConfirmSyncResponse.success(newVersion);
    }

    private ConfirmSyncResponse conflict(String workspaceId, ConflictReason reason, long currentVersion, String message) {
        log.info("confirm 冲突：workspace={}，原因 {}，当前版本 {}", workspaceId, reason.value(), currentVersion);
        return ConfirmSyncResponse.conflict(reason, currentVersion, message);
    }

    private static Map<String, FileAction> indexByPath(List<FileAction> actions) {
        Map<String, FileAction> byPath = new LinkedHashMap<>();
        for (FileAction action : actions) {
            if (action == null || action.action() == null || action.kind() == null) {
                throw new SyncValidationException("syncActions 中的每一项都必须指定 action 与 kind");
            }
            String path = WorkspacePaths.requireValid(action.filePath());
            if (byPath.put(path, action) != null) {
                throw new SyncValidationException("路径重复：" + path);
            }
        }
        return byPath;
    }

    private static void requireMatchesReservation(Pending pending, Map<String, FileAction> finalized) {
        if (!pending.actions().keySet().equals(finalized.keySet())) {
            throw new SyncValidationException("最终动作的路径集合与 sync 阶段预留的不一致");
        }
        for (FileAction action : finalized.values()) {
            ReservedAction reserved = pending.actions().get(action.filePath());
            String path = action.filePath();
            if (!reserved.matches(action)) {
                throw new SyncValidationException("最终动作与预留不一致（fileId/对象键/类型/动作/哈希）：" + path);
            }
            if (reserved.action().requiresTransfer() && (action.size() == null || action.size() < 0)) {
                throw new SyncValidationException("文件 upsert 必须携带 size：" + path);
            }
        }
    }

    private void verifyUploadedObjects(Iterable<FileAction> actions) {
        for (FileAction action : actions) {
            if (action.action() != ConfirmAction.UPSERT || action.kind() != EntryKind.FILE) {
                continue;
            }
            Optional<BlobInfo> info;
            try {
                info = blobStore.stat(action.storageKey());
            } catch (IOException e) {
                throw new WorkspaceSyncException("读取对象信息失败：" + action.storageKey(), e);
            }
            if (info.isEmpty()) {
                throw new SyncValidationException("对象尚未上传：" + action.filePath());
            }
            if (info.get().size() != action.size() || !info.get().sha256().equalsIgnoreCase(action.clientHash())) {
                throw new SyncValidationException("对象存储中的内容与声明不一致：" + action.filePath());
            }
        }
    }

    private static WorkspaceRecord apply(WorkspaceRecord current, Iterable<FileAction> actions, Instant now) {
        Map<String, ManifestEntry> entries = new TreeMap<>(current.entries());
        for (FileAction action : actions) {
            String path = action.filePath();
            if (action.action() == ConfirmAction.DELETE) {
                entries.remove(path);
                continue;
            }
            ManifestEntry previous = entries.get(path);
            Instant createdAt = previous == null ? now : previous.createdAt();
            ManifestEntry next = action.kind() == EntryKind.FOLDER
                    ? new ManifestEntry(path, action.fileId(), null, EntryKind.FOLDER, null, null, createdAt, now, null)
                    : new ManifestEntry(path, action.fileId(), action.storageKey(), EntryKind.FILE,
                    action.clientHash().toLowerCase(Locale.ROOT), action.size(), createdAt, now, null);
            entries.put(path, next);
        }
        return current.withManifest(current.version() + 1, entries);
    }

    private void deleteUnreferencedObjects(CommitResult result, Iterable<FileAction> actions) {
        List<String> obsolete = new ArrayList<>();
        for (FileAction action : actions) {
            ManifestEntry before = result.previous().entries().get(action.filePath());
            if (before == null || before.storageKey() == null) {
                continue;
            }
            ManifestEntry after = result.current().entries().get(action.filePath());
            if (after == null || !before.storageKey().equals(after.storageKey())) {
                obsolete.add(before.storageKey());
            }
        }
        for (String storageKey : obsolete) {
            try {
                blobStore.delete(storageKey);
            } catch (IOException | RuntimeException e) {
                log.warn("提交后删除旧对象失败，留待后续清理：{}", storageKey, e);
            }
        }
    }
}
