package org.codesync.sync.execution;

/**
 * 执行引擎的入口（外部协作方）。同步核心只负责把“已提交版本 + 入口文件”交出去，不关心执行结果。
 */
public interface ExecutionGateway {

    /**
     * @return 任务标识；状态通过 {@link JobStatusChannel} 获取
     */
    String submit(ExecutionJob job);
}
