package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 第二阶段（confirm）中单个路径的最终动作。
 *
 * @param filePath   路径
 * @param fileId     sync 阶段分配的文件标识
 * @param storageKey sync 阶段分配的对象存储键（目录为 null）
 * @param action     upsert / delete
 * @param kind       条目类型
 * @param clientHash 上传后客户端重新计算的 sha256（仅文件 upsert）
 * @param size       上传的字节数（仅文件 upsert）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileAction(
        String filePath,
        String fileId,
        String storageKey,
        ConfirmAction action,
        EntryKind kind,
        String clientHash,
        Long size
) {
}
