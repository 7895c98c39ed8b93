package org.codesync.sync.dto;

import java.time.Instant;

/**
 * 工作区列表中的一项。
 *
 * @param workspaceId 工作区标识
 * @param name        名称
 * @param createdBy   创建者
 * @param createdAt   创建时间
 * @param userRole    查询用户在该工作区中的角色（owner/member）
 */
public record WorkspaceSummary(
        String workspaceId,
        String name,
        String createdBy,
        Instant createdAt,
        String userRole
) {
}
