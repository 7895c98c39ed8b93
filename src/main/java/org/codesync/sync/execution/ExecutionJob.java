package org.codesync.sync.execution;

/**
 * 交给执行引擎的任务描述：始终绑定一个已提交的工作区版本。
 *
 * @param workspaceId      工作区
 * @param workspaceVersion 已提交版本
 * @param entrypointFile   入口文件路径
 * @param input            标准输入
 * @param language         语言
 */
public record ExecutionJob(
        String workspaceId,
        long workspaceVersion,
        String entrypointFile,
        String input,
        String language
) {
}
