package org.codesync.sync;

/**
 * 同步协议相关异常的基类。
 * <p>
 * 所有子类都在“同步轮次”的边界被处理：客户端不会自动重试单个步骤，而是报告失败并要求重新发起一轮
 * （重新拉取清单 -> 重新计算差异）。
 */
public class WorkspaceSyncException extends RuntimeException {

    public WorkspaceSyncException(String message) {
        super(message);
    }

    public WorkspaceSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
