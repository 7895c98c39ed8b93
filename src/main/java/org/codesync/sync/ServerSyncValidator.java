package org.codesync.sync;

import org.codesync.sync.Reservation.Pending;
import org.codesync.sync.Reservation.ReservedAction;
import org.codesync.sync.dto.ChangeAction;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.RequiredAction;
import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.dto.SyncFileClientState;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.store.MetadataStore;
import org.codesync.sync.store.WorkspaceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 第一阶段（sync / prepare）：版本校验 + 为每个变更路径下发处理要求。
 * <p>
 * 行为：
 * <ul>
 *   <li>客户端版本与已提交版本不一致时直接返回 workspace_conflict，不做任何分配。</li>
 *   <li>新建/修改的文件：分配（或沿用）fileId，分配新的对象键并签发上传凭证。</li>
 *   <li>新建目录：upload，但没有凭证和对象键；已存在的目录：none。</li>
 *   <li>删除：回显已提交的 fileId/对象键，不签发凭证；路径不存在时为 none。</li>
 *   <li>存在有效动作时预留 {@code provisionalVersion = clientVersion + 1}，否则返回 no_changes。</li>
 * </ul>
 * <p>
 * 这一阶段只读取元数据，从不修改持久化状态。
 */
public class ServerSyncValidator {

    private static final Logger log = LoggerFactory.getLogger(ServerSyncValidator.class);

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final MetadataStore metadataStore;
    private final SyncReservationStore reservations;
    private final UploadCapabilityIssuer capabilityIssuer;
    private final int maxFilesPerSync;

    public ServerSyncValidator(
            MetadataStore metadataStore,
            SyncReservationStore reservations,
            UploadCapabilityIssuer capabilityIssuer,
            int maxFilesPerSync
    ) {
        this.metadataStore = metadataStore;
        this.reservations = reservations;
        this.capabilityIssuer = capabilityIssuer;
        this.maxFilesPerSync = maxFilesPerSync;
    }

    public SyncResponse sync(String workspaceId, SyncRequest request) {
        List<SyncFileClientState> files = validateRequest(request);
        WorkspaceRecord record = metadataStore.find(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException(workspaceId));

        // OCC 闸门：客户端基于的版本必须就是当前已提交版本
        long clientVersion = request.workspaceVersion();
        if (clientVersion != record.version()) {
            log.info("sync 版本冲突：workspace={}，客户端版本 {}，当前版本 {}", workspaceId, clientVersion, record.version());
            return SyncResponse.conflict(record.version());
        }

        List<SyncAction> actions = new ArrayList<>(files.size());
        Map<String, ReservedAction> reserved = new LinkedHashMap<>();
        for (SyncFileClientState change : files) {
            ManifestEntry existing = record.entries().get(change.filePath());
            SyncAction action = decide(workspaceId, change, existing);
            actions.add(action);
            if (action.isEffective()) {
                String anticipatedHash = action.requiresTransfer() ? change.clientHash() : null;
                reserved.put(action.filePath(), new ReservedAction(action.withoutCapability(), anticipatedHash));
            }
        }
        actions.sort(Comparator.comparing(SyncAction::filePath));

        if (reserved.isEmpty()) {
            log.debug("sync 无有效变更：workspace={}@{}", workspaceId, record.version());
            return SyncResponse.noChanges(actions, record.version());
        }

        Pending pending = reservations.reserve(workspaceId, record.version(), reserved);
        log.info("sync 已受理：workspace={}，基于版本 {}，预留版本 {}，有效动作 {} 个，reservation={}",
                workspaceId, pending.baseVersion(), pending.provisionalVersion(), reserved.size(), pending.reservationId());
        return SyncResponse.accepted(actions, pending.provisionalVersion(), pending.reservationId(), record.version());
    }

    private SyncAction decide(String workspaceId, SyncFileClientState change, ManifestEntry existing) {
        String path = change.filePath();
        if (existing != null && existing.kind() != change.kind()) {
            throw new SyncValidationException("路径类型不匹配（已提交为 " + existing.kind().value()
                    + "，请求为 " + change.kind().value() + "）：" + path + "；请先删除再重新创建");
        }

        if (change.action() == ChangeAction.DELETED) {
            if (existing == null) {
                return SyncAction.none(path, change.kind(), null, null, "路径不存在，无需删除");
            }
            return new SyncAction(path, existing.kind(), existing.fileId(), existing.storageKey(),
                    RequiredAction.DELETE, null, null, null);
        }

        if (change.kind() == EntryKind.FOLDER) {
            if (existing != null) {
                return SyncAction.none(path, EntryKind.FOLDER, existing.fileId(), null, "目录已存在");
            }
            return new SyncAction(path, EntryKind.FOLDER, newId(), null, RequiredAction.UPLOAD, null, null, null);
        }

        if (existing != null && change.clientHash().equals(existing.contentHash())) {
            return SyncAction.none(path, EntryKind.FILE, existing.fileId(), existing.storageKey(), "内容未变化");
        }
        // 修改的文件沿用 fileId，但总是写入新的对象键：提交前不会覆盖已提交内容
        String fileId = existing == null ? newId() : existing.fileId();
        String storageKey = "workspaces/" + workspaceId + "/files/" + fileId + "/" + newId();
        UploadCapabilityIssuer.Capability capability = capabilityIssuer.issueUpload(storageKey, change.clientHash());
        return new SyncAction(path, EntryKind.FILE, fileId, storageKey, RequiredAction.UPLOAD,
                capability.url(), capability.expiresAt(), null);
    }

    private List<SyncFileClientState> validateRequest(SyncRequest request) {
        if (request == null || request.workspaceVersion() == null) {
            throw new SyncValidationException("sync 请求必须携带 workspaceVersion");
        }
        List<SyncFileClientState> files = request.files() == null ? List.of() : request.files();
        if (files.size() > maxFilesPerSync) {
            throw new SyncValidationException("单次同步的文件数超过上限 " + maxFilesPerSync + "：" + files.size());
        }
        Set<String> seen = new HashSet<>();
        for (SyncFileClientState change : files) {
            if (change == null) {
                throw new SyncValidationException("files 中不能包含空项");
            }
            String path = WorkspacePaths.requireValid(change.filePath());
            if (!seen.add(path)) {
                throw new SyncValidationException("路径重复：" + path);
            }
            if (change.kind() == null || change.action() == null) {
                throw new SyncValidationException("必须指定 kind 与 action：" + path);
            }
            if (change.kind() == EntryKind.FOLDER && change.action() == ChangeAction.MODIFIED) {
                throw new SyncValidationException("目录没有内容，不能标记为 modified：" + path);
            }
            if (change.kind() == EntryKind.FILE && change.action() != ChangeAction.DELETED) {
                String hash = change.clientHash();
                if (hash == null || !SHA256_HEX.matcher(hash.toLowerCase(Locale.ROOT)).matches()) {
                    throw new SyncValidationException("新建/修改的文件必须携带 sha256 clientHash：" + path);
                }
            }
        }
        return files.stream()
                .map(this::normalizeHash)
                .toList();
    }

    private SyncFileClientState normalizeHash(SyncFileClientState change) {
        if (change.clientHash() == null) {
            return change;
        }
        return new SyncFileClientState(change.filePath(), change.kind(), change.action(),
                change.clientHash().toLowerCase(Locale.ROOT));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
