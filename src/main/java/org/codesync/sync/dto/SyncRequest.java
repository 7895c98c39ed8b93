package org.codesync.sync.dto;

import java.util.List;

/**
 * 第一阶段（sync）请求。
 *
 * @param workspaceVersion 客户端最近一次已知的工作区版本（OCC 令牌）
 * @param files            客户端检测到的变更集合
 */
public record SyncRequest(
        Long workspaceVersion,
        List<SyncFileClientState> files
) {
}
