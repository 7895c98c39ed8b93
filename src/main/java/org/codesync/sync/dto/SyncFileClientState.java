package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 客户端差异计算的输出，也是 sync 请求中的单个文件项。
 *
 * @param filePath   路径
 * @param kind       条目类型
 * @param action     变更类型（new/modified/deleted）
 * @param clientHash 客户端内容 sha256（仅 new/modified 的文件携带）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncFileClientState(
        String filePath,
        EntryKind kind,
        ChangeAction action,
        String clientHash
) {
}
