package org.codesync.client;

import org.codesync.sync.HashingUtils;
import org.codesync.sync.UploadFailureException;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.RequiredAction;
import org.codesync.sync.dto.SyncAction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void uploadAll_returnsReceiptsRecomputedFromSentBytes() {
        Map<String, byte[]> stored = new ConcurrentHashMap<>();
        UploadExecutor executor = new UploadExecutor((path, url, content) -> stored.put(url, content), pool);
        byte[] a = "a".getBytes(StandardCharsets.UTF_8);
        byte[] b = "bb".getBytes(StandardCharsets.UTF_8);

        List<UploadReceipt> receipts = executor.uploadAll(List.of(task("/b.py", b), task("/a.py", a)));

        assertThat(receipts).containsExactly(
                new UploadReceipt("/a.py", "key:/a.py", HashingUtils.sha256Hex(a), 1),
                new UploadReceipt("/b.py", "key:/b.py", HashingUtils.sha256Hex(b), 2));
        assertThat(stored).containsOnlyKeys("cap:/a.py", "cap:/b.py");
    }

    @Test
    void uploadAll_firstFailureCancelsRemainingTransfers() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(1);
        AtomicBoolean slowInterrupted = new AtomicBoolean();
        UploadExecutor executor = new UploadExecutor((path, url, content) -> {
            if (path.equals("/slow.py")) {
                slowStarted.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    slowInterrupted.set(true);
                    Thread.currentThread().interrupt();
                }
                return;
            }
            try {
                slowStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("connection reset");
        }, pool);

        assertThatThrownBy(() -> executor.uploadAll(List.of(task("/slow.py", new byte[1]), task("/bad.py", new byte[1]))))
                .isInstanceOfSatisfying(UploadFailureException.class, e -> {
                    assertThat(e.getFilePath()).isEqualTo("/bad.py");
                    assertThat(e.isCapabilityExpired()).isFalse();
                });

        long deadline = System.currentTimeMillis() + 5_000;
        while (!slowInterrupted.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(slowInterrupted).isTrue();
    }

    @Test
    void uploadAll_propagatesExpiredCapability() {
        UploadExecutor executor = new UploadExecutor((path, url, content) -> {
            throw new UploadFailureException(path, true, "expired", null);
        }, pool);

        assertThatThrownBy(() -> executor.uploadAll(List.of(task("/a.py", new byte[1]))))
                .isInstanceOfSatisfying(UploadFailureException.class, e -> assertThat(e.isCapabilityExpired()).isTrue());
    }

    @Test
    void batch_cancelStopsInFlightUploads() {
        CountDownLatch release = new CountDownLatch(1);
        UploadExecutor executor = new UploadExecutor((path, url, content) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted");
            }
        }, pool);

        UploadExecutor.UploadBatch batch = executor.submit(List.of(task("/a.py", new byte[1])));
        batch.cancel();

        assertThatThrownBy(batch::await).isInstanceOf(UploadFailureException.class);
        assertThat(batch.isDone()).isTrue();
    }

    private static UploadTask task(String path, byte[] content) {
        SyncAction action = new SyncAction(path, EntryKind.FILE, "id" + path, "key:" + path, RequiredAction.UPLOAD,
                "cap:" + path, null, null);
        return new UploadTask(action, content);
    }
}
