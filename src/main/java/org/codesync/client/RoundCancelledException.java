package org.codesync.client;

import org.codesync.sync.WorkspaceSyncException;

/**
 * 轮次在发送 confirm 之前被调用方取消。
 */
public class RoundCancelledException extends WorkspaceSyncException {

    public RoundCancelledException(String workspaceId) {
        super("同步轮次已取消：" + workspaceId);
    }
}
