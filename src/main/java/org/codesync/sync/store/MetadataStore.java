package org.codesync.sync.store;

import org.codesync.sync.Reservation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 工作区元数据存储。
 * <p>
 * 清单的唯一写路径是 {@link #compareAndSet}：以“当前版本 == 期望版本”为条件的原子替换。
 * 它是每个工作区的单写者临界区，实现必须在多个无状态服务实例之间同样成立（不能依赖进程内互斥）。
 * {@link #updateReservations} 在同一个临界区内只修改预留集合。
 */
public interface MetadataStore {

    /**
     * 创建工作区文档；同名已存在时抛出 {@link IllegalStateException}。
     */
    void create(WorkspaceRecord record);

    /**
     * 读取已提交状态（读隔离即可，不加锁）。
     */
    Optional<WorkspaceRecord> find(String workspaceId);

    /**
     * 列出指定用户是成员的全部工作区（按创建时间排序）。
     */
    List<WorkspaceRecord> findByMember(String userId);

    /**
     * 在单写者临界区内修改预留集合；版本、成员与清单保持不变。
     *
     * @param mutation 接收当前预留的可变副本，返回新的预留集合
     * @return 写入后的文档
     * @throws org.codesync.sync.WorkspaceNotFoundException 工作区不存在
     */
    WorkspaceRecord updateReservations(String workspaceId, UnaryOperator<Map<String, Reservation>> mutation);

    /**
     * 条件写入：仅当存储中的版本等于 {@code expectedVersion} 时应用 {@code mutation}。
     *
     * @param mutation 由当前文档计算新文档；新文档版本必须恰好为 {@code expectedVersion + 1}
     * @throws org.codesync.sync.VersionConflictException   版本已变化（写入未发生）
     * @throws org.codesync.sync.WorkspaceNotFoundException 工作区不存在
     */
    CommitResult compareAndSet(String workspaceId, long expectedVersion, UnaryOperator<WorkspaceRecord> mutation);

    Comparator<WorkspaceRecord> BY_CREATION = Comparator.comparing(WorkspaceRecord::createdAt)
            .thenComparing(WorkspaceRecord::workspaceId);

    static void requireAdvanceByOne(WorkspaceRecord current, WorkspaceRecord next) {
        if (next == null || next.version() != current.version() + 1) {
            throw new IllegalStateException("提交必须把版本恰好推进 1：" + current.version() + " -> "
                    + (next == null ? "null" : next.version()));
        }
        if (!current.workspaceId().equals(next.workspaceId())) {
            throw new IllegalStateException("提交不能修改工作区标识");
        }
    }
}
