package org.codesync.client;

import java.util.List;

/**
 * 一轮同步的结果。
 *
 * @param finalState       EXECUTE 或 ABORTED
 * @param transitions      本轮经过的状态（按顺序）
 * @param workspaceVersion 本轮结束时客户端缓存的版本
 * @param jobId            触发执行时的任务标识
 * @param userMessage      给用户看的提示（仅 ABORTED）
 * @param error            失败原因（仅 ABORTED）
 */
public record RoundResult(
        RoundState finalState,
        List<RoundState> transitions,
        Long workspaceVersion,
        String jobId,
        String userMessage,
        RuntimeException error
) {

    public RoundResult {
        transitions = List.copyOf(transitions);
    }

    public boolean isSuccess() {
        return finalState == RoundState.EXECUTE;
    }
}
