package org.codesync.client;

import org.codesync.sync.VersionConflictException;
import org.codesync.sync.WorkspaceSyncException;
import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.dto.SyncFileClientState;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 客户端第一阶段：发送“基于的版本 + 变更集合”，把服务端响应整理为 {@link SyncPlan}。
 * <p>
 * workspace_conflict 以 {@link VersionConflictException} 抛出，携带服务端当前版本。
 */
public class SyncCoordinator {

    private final WorkspaceSyncApi api;

    public SyncCoordinator(WorkspaceSyncApi api) {
        this.api = api;
    }

    public SyncPlan prepare(String workspaceId, long baseVersion, Collection<SyncFileClientState> changes) {
        List<SyncFileClientState> files = new ArrayList<>(changes);
        files.sort(Comparator.comparing(SyncFileClientState::filePath));
        Map<String, String> requestedHashes = new HashMap<>();
        for (SyncFileClientState change : files) {
            if (change.clientHash() != null) {
                requestedHashes.put(change.filePath(), change.clientHash());
            }
        }

        SyncResponse response = api.sync(workspaceId, new SyncRequest(baseVersion, files));
        if (response == null || response.status() == null) {
            throw new WorkspaceSyncException("sync 响应为空");
        }
        switch (response.status()) {
            case WORKSPACE_CONFLICT -> throw new VersionConflictException(
                    response.currentVersion() == null ? -1 : response.currentVersion(),
                    response.errorMessage() == null ? "工作区版本冲突" : response.errorMessage());
            case ERROR -> throw new WorkspaceSyncException("sync 失败：" + response.errorMessage());
            case NO_CHANGES -> {
                return new SyncPlan(response.status(), baseVersion, null, null, actionsOf(response), requestedHashes);
            }
            case OK -> {
                if (response.provisionalVersion() == null || response.provisionalVersion() != baseVersion + 1) {
                    throw new WorkspaceSyncException("sync 响应的预留版本不合法：" + response.provisionalVersion());
                }
                List<SyncAction> actions = actionsOf(response);
                for (SyncAction action : actions) {
                    if (action.requiresTransfer() && action.uploadCapability() == null) {
                        throw new WorkspaceSyncException("服务端未下发上传凭证：" + action.filePath());
                    }
                }
                return new SyncPlan(response.status(), baseVersion, response.provisionalVersion(),
                        response.reservationId(), actions, requestedHashes);
            }
            default -> throw new WorkspaceSyncException("未知的 sync 状态：" + response.status());
        }
    }

    private static List<SyncAction> actionsOf(SyncResponse response) {
        return response.actions() == null ? List.of() : response.actions();
    }
}
