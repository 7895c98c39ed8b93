package org.codesync.client;

import org.codesync.sync.SyncValidationException;
import org.codesync.sync.WorkspacePaths;
import org.codesync.sync.dto.ChangeAction;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.SyncFileClientState;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 计算客户端当前文件集合与最后一次拉取的清单之间的差异。
 * <p>
 * 规则：
 * <ul>
 *   <li>只在客户端存在：new（文件附带哈希，目录不带）。</li>
 *   <li>两边都有的文件且哈希不同：modified；目录永远不会是 modified。</li>
 *   <li>只在清单中存在：deleted，类型取自清单。</li>
 *   <li>未变化的路径不输出。</li>
 * </ul>
 * 输出是集合，与输入顺序无关。
 */
public class ManifestDiffer {

    public Set<SyncFileClientState> diff(Collection<ClientFileState> files, Collection<ManifestEntry> manifest) {
        Map<String, ClientFileState> local = new HashMap<>();
        for (ClientFileState file : files) {
            String path = WorkspacePaths.requireValid(file.filePath());
            if (file.kind() == null) {
                throw new SyncValidationException("本地条目缺少类型：" + path);
            }
            if (local.put(path, file) != null) {
                throw new SyncValidationException("本地文件路径重复：" + path);
            }
        }
        Map<String, ManifestEntry> remote = new HashMap<>();
        for (ManifestEntry entry : manifest) {
            remote.put(entry.filePath(), entry);
        }

        Set<SyncFileClientState> changes = new HashSet<>();
        for (ClientFileState file : local.values()) {
            ManifestEntry committed = remote.get(file.filePath());
            if (committed == null) {
                String hash = file.kind() == EntryKind.FILE ? file.contentHash() : null;
                changes.add(new SyncFileClientState(file.filePath(), file.kind(), ChangeAction.NEW, hash));
                continue;
            }
            if (committed.kind() != file.kind()) {
                throw new SyncValidationException("路径类型与已提交的不一致：" + file.filePath() + "；请先删除再重新创建");
            }
            if (file.kind() == EntryKind.FILE) {
                String hash = file.contentHash();
                if (!hash.equals(committed.contentHash())) {
                    changes.add(new SyncFileClientState(file.filePath(), EntryKind.FILE, ChangeAction.MODIFIED, hash));
                }
            }
        }
        Set<String> localPaths = new HashSet<>(local.keySet());
        for (ManifestEntry entry : remote.values()) {
            if (!localPaths.contains(entry.filePath())) {
                changes.add(new SyncFileClientState(entry.filePath(), entry.kind(), ChangeAction.DELETED, null));
            }
        }
        return changes;
    }
}
