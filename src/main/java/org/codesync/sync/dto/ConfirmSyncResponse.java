package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 第二阶段（confirm）响应。
 *
 * @param status                success / conflict / error
 * @param finalWorkspaceVersion 提交成功后的工作区版本
 * @param conflictReason        冲突原因（仅 conflict）
 * @param currentVersion        服务端当前已提交版本（conflict/error 时用于客户端重新同步）
 * @param errorMessage          错误/冲突说明
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfirmSyncResponse(
        ConfirmStatus status,
        Long finalWorkspaceVersion,
        ConflictReason conflictReason,
        Long currentVersion,
        String errorMessage
) {

    public static ConfirmSyncResponse success(long finalWorkspaceVersion) {
        return new ConfirmSyncResponse(ConfirmStatus.SUCCESS, finalWorkspaceVersion, null, finalWorkspaceVersion, null);
    }

    public static ConfirmSyncResponse conflict(ConflictReason reason, Long currentVersion, String message) {
        return new ConfirmSyncResponse(ConfirmStatus.CONFLICT, null, reason, currentVersion, message);
    }

    public static ConfirmSyncResponse error(Long currentVersion, String message) {
        return new ConfirmSyncResponse(ConfirmStatus.ERROR, null, null, currentVersion, message);
    }
}
