package org.codesync.sync.store;

/**
 * 一次条件写入的前后状态。
 *
 * @param previous 写入前的文档
 * @param current  写入后的文档（version = previous.version + 1）
 */
public record CommitResult(WorkspaceRecord previous, WorkspaceRecord current) {
}
