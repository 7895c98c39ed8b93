package org.codesync.sync;

/**
 * 对象存储访问凭证校验失败。过期与签名无效需要区分：过期时客户端应重新发起整轮同步。
 */
public class CapabilityRejectedException extends WorkspaceSyncException {

    private final boolean expired;

    public CapabilityRejectedException(boolean expired, String message) {
        super(message);
        this.expired = expired;
    }

    public boolean isExpired() {
        return expired;
    }
}
