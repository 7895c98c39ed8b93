package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * 工作区清单（manifest）中的单个条目：已提交版本中一个文件或目录的权威描述。
 *
 * @param filePath    工作区内路径（以 / 开头、/ 分隔，在工作区内唯一）
 * @param fileId      稳定的文件标识（同一路径在多次修改之间保持不变）
 * @param storageKey  对象存储中的对象键（目录为 null）
 * @param kind        条目类型（file/folder）
 * @param contentHash 内容 sha256（目录为 null）
 * @param size        内容字节数（目录为 null）
 * @param createdAt   首次提交时间
 * @param updatedAt   最近一次提交时间
 * @param downloadUrl 仅在拉取清单时附带的短时下载地址（持久化时为 null）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
        String filePath,
        String fileId,
        String storageKey,
        EntryKind kind,
        String contentHash,
        Long size,
        Instant createdAt,
        Instant updatedAt,
        String downloadUrl
) {

    public static ManifestEntry folder(String filePath, String fileId, Instant at) {
        return new ManifestEntry(filePath, fileId, null, EntryKind.FOLDER, null, null, at, at, null);
    }

    public static ManifestEntry file(String filePath, String fileId, String storageKey, String contentHash, long size, Instant at) {
        return new ManifestEntry(filePath, fileId, storageKey, EntryKind.FILE, contentHash, size, at, at, null);
    }

    @JsonIgnore
    public boolean isFile() {
        return kind == EntryKind.FILE;
    }

    public ManifestEntry withDownloadUrl(String url) {
        return new ManifestEntry(filePath, fileId, storageKey, kind, contentHash, size, createdAt, updatedAt, url);
    }
}
