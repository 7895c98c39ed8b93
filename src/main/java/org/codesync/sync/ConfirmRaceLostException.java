package org.codesync.sync;

import org.codesync.sync.dto.ConflictReason;

/**
 * confirm 阶段发现预留已失效（被并发提交抢先、已过期或已提交过）。
 * <p>
 * 语义上等同于 {@link VersionConflictException}，只是在提交时才被发现。
 */
public class ConfirmRaceLostException extends WorkspaceSyncException {

    private final ConflictReason reason;
    private final Long currentVersion;

    public ConfirmRaceLostException(ConflictReason reason, Long currentVersion, String message) {
        super(message);
        this.reason = reason;
        this.currentVersion = currentVersion;
    }

    public ConflictReason getReason() {
        return reason;
    }

    public Long getCurrentVersion() {
        return currentVersion;
    }

    public boolean isExpired() {
        return reason == ConflictReason.RESERVATION_EXPIRED;
    }
}
