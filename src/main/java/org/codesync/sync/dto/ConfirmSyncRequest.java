package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 第二阶段（confirm）请求。
 *
 * @param workspaceVersion sync 阶段返回的 provisionalVersion
 * @param reservationId    sync 阶段返回的预留标识（可选；缺省时按版本 + 动作集合匹配预留）
 * @param syncActions      最终确认的动作集合
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfirmSyncRequest(
        Long workspaceVersion,
        String reservationId,
        List<FileAction> syncActions
) {
}
