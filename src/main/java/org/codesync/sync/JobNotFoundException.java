package org.codesync.sync;

public class JobNotFoundException extends WorkspaceSyncException {

    public JobNotFoundException(String jobId) {
        super("执行任务不存在：" + jobId);
    }
}
