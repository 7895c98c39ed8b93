package org.codesync.client;

/**
 * 一轮同步的状态。EXECUTE 与 ABORTED 是一轮的终态；ABORTED 之后客户端回到 IDLE。
 */
public enum RoundState {
    IDLE,
    DIFFING,
    SYNCING,
    UPLOADING,
    CONFIRMING,
    EXECUTE,
    ABORTED
}
