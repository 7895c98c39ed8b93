package org.codesync.sync.execution;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * 执行状态通道：调用方可以轮询，也可以订阅。
 */
public interface JobStatusChannel {

    Optional<JobStatus> poll(String jobId);

    /**
     * 订阅某个任务的状态变化；订阅时如果任务已存在，会先收到一次当前状态。
     */
    Subscription subscribe(String jobId, Consumer<JobStatus> listener);

    interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
