package org.codesync.sync;

/**
 * 版本冲突：客户端提交的版本与服务端已提交版本不一致。
 * <p>
 * 始终携带服务端的权威版本，客户端据此重新同步。
 */
public class VersionConflictException extends WorkspaceSyncException {

    private final long currentVersion;

    public VersionConflictException(long currentVersion, String message) {
        super(message);
        this.currentVersion = currentVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
