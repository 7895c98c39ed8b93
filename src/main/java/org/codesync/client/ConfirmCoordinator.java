package org.codesync.client;

import org.codesync.sync.ConfirmRaceLostException;
import org.codesync.sync.SyncValidationException;
import org.codesync.sync.WorkspaceSyncException;
import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.RequiredAction;
import org.codesync.sync.dto.SyncAction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 客户端第二阶段：所有上传成功后，把动作整理成最终形式并提交。
 * <p>
 * 不做任何重试：conflict 以 {@link ConfirmRaceLostException} 抛出，error 以 {@link WorkspaceSyncException} 抛出。
 */
public class ConfirmCoordinator {

    private final WorkspaceSyncApi api;

    public ConfirmCoordinator(WorkspaceSyncApi api) {
        this.api = api;
    }

    public ConfirmedSync confirm(String workspaceId, SyncPlan plan, List<UploadReceipt> receipts) {
        if (!plan.hasEffectiveActions()) {
            throw new IllegalStateException("没有需要确认的动作");
        }
        Map<String, UploadReceipt> byPath = new HashMap<>();
        for (UploadReceipt receipt : receipts) {
            byPath.put(receipt.filePath(), receipt);
        }

        List<FileAction> finalized = new ArrayList<>();
        for (SyncAction action : plan.effectiveActions()) {
            finalized.add(finalize(action, byPath.get(action.filePath()), plan.requestedHashes().get(action.filePath())));
        }

        ConfirmSyncResponse response = api.confirm(workspaceId,
                new ConfirmSyncRequest(plan.provisionalVersion(), plan.reservationId(), finalized));
        if (response == null || response.status() == null) {
            throw new WorkspaceSyncException("confirm 响应为空");
        }
        return switch (response.status()) {
            case SUCCESS -> new ConfirmedSync(response.finalWorkspaceVersion(), finalized);
            case CONFLICT -> throw new ConfirmRaceLostException(response.conflictReason(), response.currentVersion(),
                    response.errorMessage() == null ? "confirm 冲突" : response.errorMessage());
            case ERROR -> throw new WorkspaceSyncException("confirm 失败：" + response.errorMessage());
        };
    }

    private static FileAction finalize(SyncAction action, UploadReceipt receipt, String requestedHash) {
        if (action.actionRequired() == RequiredAction.DELETE) {
            return new FileAction(action.filePath(), action.fileId(), action.storageKey(), ConfirmAction.DELETE,
                    action.kind(), null, null);
        }
        if (action.kind() == EntryKind.FOLDER) {
            return new FileAction(action.filePath(), action.fileId(), null, ConfirmAction.UPSERT, EntryKind.FOLDER, null, null);
        }
        if (receipt == null) {
            throw new SyncValidationException("文件没有上传回执：" + action.filePath());
        }
        if (!receipt.contentHash().equals(requestedHash)) {
            throw new SyncValidationException("上传内容与 sync 时声明的不一致：" + action.filePath());
        }
        return new FileAction(action.filePath(), action.fileId(), action.storageKey(), ConfirmAction.UPSERT,
                EntryKind.FILE, receipt.contentHash(), receipt.size());
    }
}
