package org.codesync.sync;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.RequiredAction;
import org.codesync.sync.dto.SyncAction;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 版本预留：sync 与 confirm 之间的“已准备、未提交”事务句柄。
 * <p>
 * 显式区分两种状态，让过期与已提交都可以被直接判断和测试：
 * <ul>
 *   <li>{@link Pending}：绑定一组动作，等待 confirm；超过 {@code expiresAt} 即失效。</li>
 *   <li>{@link Committed}：已成功提交，记录提交后的版本。</li>
 * </ul>
 * 预留随工作区文档一起持久化（见 {@link org.codesync.sync.store.WorkspaceRecord#reservations()}）。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "state")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Reservation.Pending.class, name = "pending"),
        @JsonSubTypes.Type(value = Reservation.Committed.class, name = "committed")
})
public sealed interface Reservation permits Reservation.Pending, Reservation.Committed {

    String reservationId();

    String workspaceId();

    Map<String, ReservedAction> actions();

    /**
     * 最终动作集合与预留的动作集合是否完全一致（路径、fileId、对象键、类型、动作、哈希）。
     */
    default boolean sameActions(Map<String, FileAction> finalized) {
        if (!actions().keySet().equals(finalized.keySet())) {
            return false;
        }
        for (Map.Entry<String, FileAction> entry : finalized.entrySet()) {
            if (!actions().get(entry.getKey()).matches(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param reservationId 预留标识
     * @param workspaceId   工作区
     * @param baseVersion   sync 时的已提交版本
     * @param actions       路径 -> 预留动作（仅 upload/delete）
     * @param createdAt     创建时间
     * @param expiresAt     过期时间
     */
    record Pending(
            String reservationId,
            String workspaceId,
            long baseVersion,
            Map<String, ReservedAction> actions,
            Instant createdAt,
            Instant expiresAt
    ) implements Reservation {

        public Pending {
            actions = Map.copyOf(actions);
        }

        public long provisionalVersion() {
            return baseVersion + 1;
        }

        public boolean isExpiredAt(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    record Committed(
            String reservationId,
            String workspaceId,
            long version,
            Map<String, ReservedAction> actions,
            Instant committedAt
    ) implements Reservation {

        public Committed {
            actions = actions == null ? Map.of() : Map.copyOf(actions);
        }
    }

    /**
     * @param action          sync 阶段下发的动作（不含凭证）
     * @param anticipatedHash sync 请求中客户端声明的内容哈希（目录与删除为 null）
     */
    record ReservedAction(SyncAction action, String anticipatedHash) {

        public ConfirmAction expectedConfirmAction() {
            return action.actionRequired() == RequiredAction.DELETE ? ConfirmAction.DELETE : ConfirmAction.UPSERT;
        }

        public boolean matches(FileAction finalized) {
            if (!Objects.equals(action.fileId(), finalized.fileId())
                    || !Objects.equals(action.storageKey(), finalized.storageKey())
                    || action.kind() != finalized.kind()
                    || expectedConfirmAction() != finalized.action()) {
                return false;
            }
            if (!action.requiresTransfer()) {
                return true;
            }
            String hash = finalized.clientHash() == null ? null : finalized.clientHash().toLowerCase(Locale.ROOT);
            return Objects.equals(anticipatedHash, hash);
        }
    }
}
