package org.codesync.sync;

/**
 * 调用者不是工作区成员。
 */
public class WorkspaceAccessDeniedException extends WorkspaceSyncException {

    private final String workspaceId;
    private final String userId;

    public WorkspaceAccessDeniedException(String workspaceId, String userId) {
        super("用户 " + userId + " 不是工作区 " + workspaceId + " 的成员");
        this.workspaceId = workspaceId;
        this.userId = userId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getUserId() {
        return userId;
    }
}
