package org.codesync.sync.execution;

import org.codesync.sync.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryExecutionGatewayTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryExecutionGateway gateway = new InMemoryExecutionGateway(Duration.ofHours(1), clock);

    @Test
    void submit_registersQueuedJobVisibleToPoll() {
        String jobId = gateway.submit(new ExecutionJob("w1", 4, "/main.py", "", "python"));

        JobStatus status = gateway.poll(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(JobState.QUEUED);
        assertThat(status.workspaceVersion()).isEqualTo(4);
        assertThat(gateway.poll("unknown")).isEmpty();
    }

    @Test
    void subscribe_receivesCurrentStateThenUpdatesUntilClosed() {
        String jobId = gateway.submit(new ExecutionJob("w1", 4, "/main.py", null, "python"));
        List<JobState> seen = new ArrayList<>();

        JobStatusChannel.Subscription subscription = gateway.subscribe(jobId, status -> seen.add(status.state()));
        gateway.report(jobId, JobState.RUNNING, null);
        subscription.close();
        gateway.report(jobId, JobState.SUCCEEDED, "hi\n");

        assertThat(seen).containsExactly(JobState.QUEUED, JobState.RUNNING);
        assertThat(gateway.poll(jobId).orElseThrow().output()).isEqualTo("hi\n");
    }

    @Test
    void report_rejectsUpdatesAfterTerminalState() {
        String jobId = gateway.submit(new ExecutionJob("w1", 1, "/main.py", null, "python"));
        gateway.report(jobId, JobState.FAILED, "boom");

        assertThatThrownBy(() -> gateway.report(jobId, JobState.RUNNING, null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> gateway.report("missing", JobState.RUNNING, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submit_evictsTerminalJobsPastRetention() {
        String finished = gateway.submit(new ExecutionJob("w1", 1, "/main.py", null, "python"));
        gateway.report(finished, JobState.SUCCEEDED, "ok");
        String running = gateway.submit(new ExecutionJob("w1", 1, "/main.py", null, "python"));
        gateway.report(running, JobState.RUNNING, null);

        clock.advance(Duration.ofMinutes(30));
        gateway.submit(new ExecutionJob("w1", 2, "/main.py", null, "python"));
        assertThat(gateway.poll(finished)).isPresent();

        clock.advance(Duration.ofMinutes(31));
        gateway.submit(new ExecutionJob("w1", 3, "/main.py", null, "python"));

        assertThat(gateway.poll(finished)).isEmpty();
        assertThat(gateway.poll(running)).get().extracting(JobStatus::state).isEqualTo(JobState.RUNNING);
        assertThat(gateway.size()).isEqualTo(3);
    }
}
