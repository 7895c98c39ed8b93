package org.codesync.client;

import org.codesync.sync.dto.SyncAction;

/**
 * @param action  sync 阶段下发的 upload 动作（文件）
 * @param content 要上传的字节
 */
public record UploadTask(SyncAction action, byte[] content) {
}
