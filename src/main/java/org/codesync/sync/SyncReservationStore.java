package org.codesync.sync;

import org.codesync.sync.Reservation.Committed;
import org.codesync.sync.Reservation.Pending;
import org.codesync.sync.Reservation.ReservedAction;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.store.MetadataStore;
import org.codesync.sync.store.WorkspaceRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 版本预留存储，预留持久化在工作区文档中（经由 {@link MetadataStore}）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>sync：版本校验通过后 {@link #reserve} 生成预留（不推进版本）。</li>
 *   <li>confirm：{@link #find}/{@link #match} 取出预留，提交的条件写入中用 {@link #markCommitted}
 *       把预留改为已提交，清单与预留状态一次写入。</li>
 * </ol>
 * <p>
 * 说明：
 * <ul>
 *   <li>预留有 TTL；过期或已提交的预留在额外保留一个 TTL 后才被清理，以便 confirm 能报告准确的原因。</li>
 *   <li>预留只是提交的前置条件，真正的并发裁决是元数据存储上的条件写入。</li>
 *   <li>被抢先的预留保持 Pending，再次 confirm 仍会得到 superseded，直到过期被清理。</li>
 *   <li>共享同一元数据存储的任意服务实例都可以完成另一个实例受理的 sync。</li>
 * </ul>
 */
public class SyncReservationStore {

    private final MetadataStore metadataStore;
    private final Duration ttl;
    private final Clock clock;

    public SyncReservationStore(MetadataStore metadataStore, Duration ttl, Clock clock) {
        this.metadataStore = metadataStore;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Pending reserve(String workspaceId, long baseVersion, Map<String, ReservedAction> actions) {
        Instant now = clock.instant();
        Pending pending = new Pending(
                UUID.randomUUID().toString(),
                workspaceId,
                baseVersion,
                actions,
                now,
                now.plus(ttl)
        );
        metadataStore.updateReservations(workspaceId, current -> {
            removeStale(current, now);
            current.put(pending.reservationId(), pending);
            return current;
        });
        return pending;
    }

    /**
     * 从存储中重新读取预留的最新状态。
     */
    public Optional<Reservation> find(String workspaceId, String reservationId) {
        return metadataStore.find(workspaceId).flatMap(record -> find(record, reservationId));
    }

    public Optional<Reservation> find(WorkspaceRecord record, String reservationId) {
        if (reservationId == null || reservationId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.reservations().get(reservationId));
    }

    /**
     * 请求未携带预留标识时，按“预留版本 + 完整动作集合”匹配预留。
     * <p>
     * 动作中的对象键每次 sync 都是新分配的，因此同一路径上的两个并发预留不会互相匹配。
     * 优先返回未过期的 Pending；其次是已提交的记录，最后是已过期的 Pending（用于报告准确的冲突原因）。
     */
    public Optional<Reservation> match(WorkspaceRecord record, long provisionalVersion, Map<String, FileAction> finalized) {
        Instant now = clock.instant();
        Reservation committedMatch = null;
        Reservation expiredMatch = null;
        for (Reservation reservation : record.reservations().values()) {
            if (!reservation.sameActions(finalized)) {
                continue;
            }
            if (reservation instanceof Pending pending && pending.provisionalVersion() == provisionalVersion) {
                if (!pending.isExpiredAt(now)) {
                    return Optional.of(pending);
                }
                expiredMatch = pending;
            } else if (reservation instanceof Committed committed && committed.version() == provisionalVersion) {
                committedMatch = committed;
            }
        }
        return Optional.ofNullable(committedMatch != null ? committedMatch : expiredMatch);
    }

    /**
     * 在提交的条件写入中调用：把 Pending 替换为 Committed，并顺带清理陈旧预留。
     *
     * @param next 已推进版本的新文档
     */
    public WorkspaceRecord markCommitted(WorkspaceRecord next, Pending pending) {
        Instant now = clock.instant();
        Map<String, Reservation> updated = new HashMap<>(next.reservations());
        removeStale(updated, now);
        updated.put(pending.reservationId(),
                new Committed(pending.reservationId(), pending.workspaceId(), next.version(), pending.actions(), now));
        return next.withReservations(updated);
    }

    public int size(String workspaceId) {
        return metadataStore.find(workspaceId).map(record -> record.reservations().size()).orElse(0);
    }

    private void removeStale(Map<String, Reservation> reservations, Instant now) {
        Instant horizon = now.minus(ttl);
        reservations.values().removeIf(value ->
                (value instanceof Pending pending && pending.expiresAt().isBefore(horizon))
                        || (value instanceof Committed committed && committed.committedAt().isBefore(horizon)));
    }
}
