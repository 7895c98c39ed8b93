package org.codesync.sync;

public class WorkspaceNotFoundException extends WorkspaceSyncException {

    private final String workspaceId;

    public WorkspaceNotFoundException(String workspaceId) {
        super("工作区不存在：" + workspaceId);
        this.workspaceId = workspaceId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }
}
