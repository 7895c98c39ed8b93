package org.codesync.client;

import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.dto.SyncStatus;

import java.util.List;
import java.util.Map;

/**
 * 第一阶段被受理后的结果：服务端下发的动作 + 预留信息。
 *
 * @param status             ok 或 no_changes
 * @param baseVersion        客户端所基于的版本
 * @param provisionalVersion 预留版本（no_changes 时为 null）
 * @param reservationId      预留标识（no_changes 时为 null）
 * @param actions            全部动作（含 none）
 * @param requestedHashes    sync 请求中声明的文件哈希（路径 -> sha256）
 */
public record SyncPlan(
        SyncStatus status,
        long baseVersion,
        Long provisionalVersion,
        String reservationId,
        List<SyncAction> actions,
        Map<String, String> requestedHashes
) {

    public SyncPlan {
        actions = List.copyOf(actions);
        requestedHashes = Map.copyOf(requestedHashes);
    }

    public boolean hasEffectiveActions() {
        return status == SyncStatus.OK && actions.stream().anyMatch(SyncAction::isEffective);
    }

    public List<SyncAction> effectiveActions() {
        return actions.stream().filter(SyncAction::isEffective).toList();
    }

    public List<SyncAction> transfers() {
        return actions.stream().filter(SyncAction::requiresTransfer).toList();
    }
}
