package org.codesync.sync.dto;

import java.time.Instant;

/**
 * @param workspaceId    新工作区标识
 * @param name           名称
 * @param createdBy      创建者
 * @param createdAt      创建时间
 * @param initialVersion 初始版本（空清单）
 */
public record CreateWorkspaceResult(
        String workspaceId,
        String name,
        String createdBy,
        Instant createdAt,
        long initialVersion
) {
}
