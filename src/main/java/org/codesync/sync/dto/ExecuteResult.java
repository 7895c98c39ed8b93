package org.codesync.sync.dto;

/**
 * @param jobId            执行任务标识（状态通过外部状态通道获取）
 * @param workspaceId      工作区标识
 * @param workspaceVersion 本次执行所针对的已提交版本
 */
public record ExecuteResult(
        String jobId,
        String workspaceId,
        long workspaceVersion
) {
}
