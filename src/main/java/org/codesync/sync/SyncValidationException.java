package org.codesync.sync;

/**
 * 请求不合法：路径格式错误、缺少必需字段、路径与类型不匹配等。
 */
public class SyncValidationException extends WorkspaceSyncException {

    public SyncValidationException(String message) {
        super(message);
    }
}
