package org.codesync.sync.execution;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * 执行任务在某一时刻的状态快照。
 *
 * @param jobId            任务标识
 * @param workspaceId      工作区
 * @param workspaceVersion 执行所针对的版本
 * @param entrypointFile   入口文件
 * @param language         语言
 * @param state            queued / running / succeeded / failed
 * @param output           输出（终态时由执行引擎回填）
 * @param updatedAt        最近更新时间
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatus(
        String jobId,
        String workspaceId,
        long workspaceVersion,
        String entrypointFile,
        String language,
        JobState state,
        String output,
        Instant updatedAt
) {

    public JobStatus withState(JobState newState, String newOutput, Instant at) {
        return new JobStatus(jobId, workspaceId, workspaceVersion, entrypointFile, language, newState, newOutput, at);
    }
}
