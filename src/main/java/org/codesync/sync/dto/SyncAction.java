package org.codesync.sync.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * 服务端针对单个路径下发的处理要求。
 *
 * @param filePath            路径
 * @param kind                条目类型
 * @param fileId              稳定文件标识
 * @param storageKey          对象存储键（目录为 null）
 * @param actionRequired      upload/delete/none
 * @param uploadCapability    上传凭证（带签名和过期时间的 URL，仅文件的 upload 动作携带）
 * @param capabilityExpiresAt 上传凭证过期时间
 * @param message             动作为 none 时的说明
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncAction(
        String filePath,
        EntryKind kind,
        String fileId,
        String storageKey,
        RequiredAction actionRequired,
        String uploadCapability,
        Instant capabilityExpiresAt,
        String message
) {

    public static SyncAction none(String filePath, EntryKind kind, String fileId, String storageKey, String message) {
        return new SyncAction(filePath, kind, fileId, storageKey, RequiredAction.NONE, null, null, message);
    }

    /**
     * 是否是需要在 confirm 阶段确认的动作（upload/delete）。
     */
    @JsonIgnore
    public boolean isEffective() {
        return actionRequired == RequiredAction.UPLOAD || actionRequired == RequiredAction.DELETE;
    }

    /**
     * 去掉上传凭证后的副本，用于持久化预留。
     */
    public SyncAction withoutCapability() {
        return new SyncAction(filePath, kind, fileId, storageKey, actionRequired, null, null, message);
    }

    public boolean requiresTransfer() {
        return actionRequired == RequiredAction.UPLOAD && kind == EntryKind.FILE;
    }
}
