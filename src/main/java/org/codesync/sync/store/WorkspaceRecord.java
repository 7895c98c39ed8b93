package org.codesync.sync.store;

import org.codesync.sync.Reservation;
import org.codesync.sync.dto.ManifestEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 元数据存储中的工作区文档：版本号（OCC 令牌）+ 成员 + 已提交清单 + 版本预留。
 * <p>
 * 不可变；每次提交整体替换为新实例，读者永远看不到“部分应用”的清单。
 * 预留与清单放在同一文档中，由同一个单写者临界区保护，任何共享该存储的服务实例都能看到。
 *
 * @param workspaceId 工作区标识
 * @param name        名称
 * @param createdBy   创建者
 * @param createdAt   创建时间
 * @param version     已提交版本
 * @param members     成员用户标识（创建者为第一个成员）
 * @param entries      路径 -> 清单条目（按路径排序）
 * @param reservations 预留标识 -> 预留（Pending 或 Committed）
 */
public record WorkspaceRecord(
        String workspaceId,
        String name,
        String createdBy,
        Instant createdAt,
        long version,
        List<String> members,
        Map<String, ManifestEntry> entries,
        Map<String, Reservation> reservations
) {

    public WorkspaceRecord {
        members = members == null ? List.of() : List.copyOf(members);
        entries = entries == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(entries));
        reservations = reservations == null ? Map.of() : Map.copyOf(reservations);
    }

    public static WorkspaceRecord create(String workspaceId, String name, String createdBy, Instant createdAt, long initialVersion) {
        List<String> members = createdBy == null ? List.of() : List.of(createdBy);
        return new WorkspaceRecord(workspaceId, name, createdBy, createdAt, initialVersion, members, Map.of(), Map.of());
    }

    public WorkspaceRecord withManifest(long newVersion, Map<String, ManifestEntry> newEntries) {
        return new WorkspaceRecord(workspaceId, name, createdBy, createdAt, newVersion, members, newEntries, reservations);
    }

    public WorkspaceRecord withReservations(Map<String, Reservation> newReservations) {
        return new WorkspaceRecord(workspaceId, name, createdBy, createdAt, version, members, entries, newReservations);
    }

    public boolean isMember(String userId) {
        return userId != null && members.contains(userId);
    }

    public List<ManifestEntry> manifest() {
        return new ArrayList<>(entries.values());
    }
}
