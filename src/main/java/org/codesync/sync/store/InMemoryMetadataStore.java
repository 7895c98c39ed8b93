package org.codesync.sync.store;

import org.codesync.sync.Reservation;
import org.codesync.sync.VersionConflictException;
import org.codesync.sync.WorkspaceNotFoundException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 内存版元数据存储，仅用于单进程部署与测试。
 * <p>
 * 条件写入基于 {@link ConcurrentHashMap#computeIfPresent} 的按 key 原子性：
 * 版本不匹配时在回调内抛出异常，映射保持不变。
 */
public class InMemoryMetadataStore implements MetadataStore {

    private final ConcurrentHashMap<String, WorkspaceRecord> workspaces = new ConcurrentHashMap<>();

    @Override
    public void create(WorkspaceRecord record) {
        WorkspaceRecord existing = workspaces.putIfAbsent(record.workspaceId(), record);
        if (existing != null) {
            throw new IllegalStateException("工作区已存在：" + record.workspaceId());
        }
    }

    @Override
    public Optional<WorkspaceRecord> find(String workspaceId) {
        if (workspaceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workspaces.get(workspaceId));
    }

    @Override
    public List<WorkspaceRecord> findByMember(String userId) {
        return workspaces.values().stream()
                .filter(record -> record.isMember(userId))
                .sorted(BY_CREATION)
                .toList();
    }

    @Override
    public WorkspaceRecord updateReservations(String workspaceId, UnaryOperator<Map<String, Reservation>> mutation) {
        if (workspaceId == null) {
            throw new WorkspaceNotFoundException(null);
        }
        WorkspaceRecord updated = workspaces.computeIfPresent(workspaceId,
                (id, current) -> current.withReservations(mutation.apply(new HashMap<>(current.reservations()))));
        if (updated == null) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return updated;
    }

    @Override
    public CommitResult compareAndSet(String workspaceId, long expectedVersion, UnaryOperator<WorkspaceRecord> mutation) {
        AtomicReference<WorkspaceRecord> previous = new AtomicReference<>();
        WorkspaceRecord updated = workspaces.computeIfPresent(workspaceId, (id, current) -> {
            if (current.version() != expectedVersion) {
                throw new VersionConflictException(current.version(),
                        "工作区版本已变化：期望 " + expectedVersion + "，当前 " + current.version());
            }
            WorkspaceRecord next = mutation.apply(current);
            MetadataStore.requireAdvanceByOne(current, next);
            previous.set(current);
            return next;
        });
        if (updated == null) {
            throw new WorkspaceNotFoundException(workspaceId);
        }
        return new CommitResult(previous.get(), updated);
    }
}
