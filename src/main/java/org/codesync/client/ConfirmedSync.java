package org.codesync.client;

import org.codesync.sync.dto.FileAction;

import java.util.List;

/**
 * confirm 成功后的结果：新版本 + 被提交的动作（用于更新本地缓存）。
 */
public record ConfirmedSync(long version, List<FileAction> actions) {

    public ConfirmedSync {
        actions = List.copyOf(actions);
    }
}
