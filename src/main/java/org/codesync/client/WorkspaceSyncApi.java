package org.codesync.client;

import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.ConfirmSyncResponse;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.WorkspaceManifest;

/**
 * 客户端看到的服务端接口。
 * <p>
 * 冲突以响应状态返回；校验失败、工作区不存在、传输失败以异常抛出。
 */
public interface WorkspaceSyncApi {

    WorkspaceManifest manifest(String workspaceId);

    SyncResponse sync(String workspaceId, SyncRequest request);

    ConfirmSyncResponse confirm(String workspaceId, ConfirmSyncRequest request);

    ExecuteResult execute(String workspaceId, ExecuteRequest request);
}
