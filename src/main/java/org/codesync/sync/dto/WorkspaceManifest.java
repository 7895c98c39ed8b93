package org.codesync.sync.dto;

import java.util.List;

/**
 * 清单拉取结果（读路径，不参与两阶段提交）。
 *
 * @param manifest         当前已提交版本的全部条目
 * @param workspaceVersion 该清单对应的工作区版本
 */
public record WorkspaceManifest(
        List<ManifestEntry> manifest,
        long workspaceVersion
) {
}
