package org.codesync.sync.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 内存版执行网关：登记任务并维护状态，真正的执行由外部执行器通过 {@link #report} 回报。
 * <p>
 * 终态任务在保留期过后被清理（提交新任务时顺带执行），清理后查询结果为不存在。
 */
public class InMemoryExecutionGateway implements ExecutionGateway, JobStatusChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionGateway.class);

    private final Duration retention;
    private final Clock clock;
    private final ConcurrentHashMap<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Consumer<JobStatus>>> listeners = new ConcurrentHashMap<>();

    public InMemoryExecutionGateway(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public String submit(ExecutionJob job) {
        cleanupFinished();
        String jobId = UUID.randomUUID().toString();
        JobStatus status = new JobStatus(
                jobId,
                job.workspaceId(),
                job.workspaceVersion(),
                job.entrypointFile(),
                job.language(),
                JobState.QUEUED,
                null,
                clock.instant()
        );
        jobs.put(jobId, status);
        log.info("执行任务已提交：jobId={}，workspace={}@{}，entrypoint={}",
                jobId, job.workspaceId(), job.workspaceVersion(), job.entrypointFile());
        publish(status);
        return jobId;
    }

    /**
     * 执行器回报状态；终态之后的回报会被拒绝。
     */
    public JobStatus report(String jobId, JobState state, String output) {
        JobStatus updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.state().isTerminal()) {
                throw new IllegalStateException("任务已结束，不能再更新状态：" + id);
            }
            return current.withState(state, output, clock.instant());
        });
        if (updated == null) {
            throw new IllegalArgumentException("未知的任务：" + jobId);
        }
        publish(updated);
        return updated;
    }

    @Override
    public Optional<JobStatus> poll(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * @return 当前登记（尚未被清理）的任务数
     */
    public int size() {
        return jobs.size();
    }

    @Override
    public Subscription subscribe(String jobId, Consumer<JobStatus> listener) {
        List<Consumer<JobStatus>> list = listeners.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>());
        list.add(listener);
        JobStatus current = jobs.get(jobId);
        if (current != null) {
            listener.accept(current);
        }
        return () -> list.remove(listener);
    }

    private void publish(JobStatus status) {
        List<Consumer<JobStatus>> list = listeners.get(status.jobId());
        if (list == null) {
            return;
        }
        for (Consumer<JobStatus> listener : list) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("任务状态订阅者处理失败：jobId={}", status.jobId(), e);
            }
        }
        if (status.state().isTerminal()) {
            listeners.remove(status.jobId());
        }
    }

    private void cleanupFinished() {
        Instant horizon = clock.instant().minus(retention);
        for (Map.Entry<String, JobStatus> entry : jobs.entrySet()) {
            JobStatus value = entry.getValue();
            if (value.state().isTerminal() && value.updatedAt().isBefore(horizon)) {
                jobs.remove(entry.getKey(), value);
            }
        }
    }
}
