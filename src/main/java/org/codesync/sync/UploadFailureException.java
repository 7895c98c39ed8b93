package org.codesync.sync;

/**
 * 向对象存储传输内容失败（网络/存储错误，或上传凭证过期）。整轮中止，服务端状态不受影响。
 */
public class UploadFailureException extends WorkspaceSyncException {

    private final String filePath;
    private final boolean capabilityExpired;

    public UploadFailureException(String filePath, boolean capabilityExpired, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
        this.capabilityExpired = capabilityExpired;
    }

    public String getFilePath() {
        return filePath;
    }

    public boolean isCapabilityExpired() {
        return capabilityExpired;
    }
}
