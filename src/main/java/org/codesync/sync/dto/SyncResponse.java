package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 第一阶段（sync）响应。
 *
 * @param status             ok / no_changes / workspace_conflict / error
 * @param actions            每个路径的处理要求
 * @param provisionalVersion 预留的下一个版本号（仅 ok 时存在）
 * @param reservationId      预留标识，confirm 时回传
 * @param currentVersion     服务端当前已提交版本
 * @param errorMessage       错误/冲突说明
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResponse(
        SyncStatus status,
        List<SyncAction> actions,
        Long provisionalVersion,
        String reservationId,
        Long currentVersion,
        String errorMessage
) {

    public static SyncResponse accepted(List<SyncAction> actions, long provisionalVersion, String reservationId, long currentVersion) {
        return new SyncResponse(SyncStatus.OK, actions, provisionalVersion, reservationId, currentVersion, null);
    }

    public static SyncResponse noChanges(List<SyncAction> actions, long currentVersion) {
        return new SyncResponse(SyncStatus.NO_CHANGES, actions, null, null, currentVersion, null);
    }

    public static SyncResponse conflict(long currentVersion) {
        return new SyncResponse(
                SyncStatus.WORKSPACE_CONFLICT,
                List.of(),
                null,
                null,
                currentVersion,
                "工作区版本冲突：本地视图已过期，请重新加载后再同步"
        );
    }

    public static SyncResponse error(String message) {
        return new SyncResponse(SyncStatus.ERROR, List.of(), null, null, null, message);
    }
}
