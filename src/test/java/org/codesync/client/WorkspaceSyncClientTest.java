package org.codesync.client;

import org.codesync.sync.ConfirmRaceLostException;
import org.codesync.sync.HashingUtils;
import org.codesync.sync.ServerFixture;
import org.codesync.sync.UploadFailureException;
import org.codesync.sync.VersionConflictException;
import org.codesync.sync.dto.ConflictReason;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.WorkspaceManifest;
import org.codesync.sync.store.WorkspaceRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class WorkspaceSyncClientTest {

    @TempDir
    Path root;

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private ServerFixture server;
    private String workspaceId;

    @BeforeEach
    void setUp() {
        server = new ServerFixture(root);
        workspaceId = server.createWorkspace();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void modifyAndAdd_fromVersion3CommitsVersion4() {
        Client client = client();
        prepareVersion3(client);
        assertThat(serverRecord().version()).isEqualTo(3);

        RoundResult result = client.run(List.of(
                ClientFileState.file("/a.py", "H2"),
                ClientFileState.file("/b.py", "H2b")));

        assertThat(result.finalState()).isEqualTo(RoundState.EXECUTE);
        assertThat(result.transitions()).containsExactly(
                RoundState.DIFFING, RoundState.SYNCING, RoundState.UPLOADING, RoundState.CONFIRMING, RoundState.EXECUTE);
        assertThat(result.workspaceVersion()).isEqualTo(4);
        assertThat(hashes(server.service.manifest(workspaceId))).containsExactlyInAnyOrderEntriesOf(Map.of(
                "/a.py", HashingUtils.sha256Hex("H2"),
                "/b.py", HashingUtils.sha256Hex("H2b")));
        assertThat(client.sync.state()).isEqualTo(RoundState.IDLE);
    }

    @Test
    void lostRace_confirmConflictsAndWorkspaceKeepsWinnerChanges() {
        Client first = client();
        Client second = client();
        prepareVersion3(first);
        second.run(List.of(ClientFileState.file("/a.py", "H1")));

        first.api.beforeConfirm = () -> {
            RoundResult winner = second.run(List.of(
                    ClientFileState.file("/a.py", "H1"),
                    ClientFileState.file("/c.py", "from second")));
            assertThat(winner.workspaceVersion()).isEqualTo(4);
        };
        RoundResult result = first.run(List.of(
                ClientFileState.file("/a.py", "H2"),
                ClientFileState.file("/b.py", "H2b")));

        assertThat(result.finalState()).isEqualTo(RoundState.ABORTED);
        assertThat(result.userMessage()).isEqualTo(WorkspaceSyncClient.MESSAGE_STALE_VIEW);
        assertThat(result.error()).isInstanceOfSatisfying(ConfirmRaceLostException.class,
                e -> assertThat(e.getReason()).isEqualTo(ConflictReason.SUPERSEDED));
        assertThat(result.workspaceVersion()).isEqualTo(3);
        assertThat(serverRecord().version()).isEqualTo(4);
        assertThat(hashes(server.service.manifest(workspaceId))).containsExactlyInAnyOrderEntriesOf(Map.of(
                "/a.py", HashingUtils.sha256Hex("H1"),
                "/c.py", HashingUtils.sha256Hex("from second")));
    }

    @Test
    void deleteOnly_removesEntryAndObjectAndAdvancesOneVersion() throws Exception {
        Client client = client();
        client.run(List.of(ClientFileState.file("/a.py", "a"), ClientFileState.file("/b.py", "b")));
        String storageKey = serverRecord().entries().get("/b.py").storageKey();

        RoundResult result = client.run(List.of(ClientFileState.file("/a.py", "a")));

        assertThat(result.workspaceVersion()).isEqualTo(3);
        assertThat(serverRecord().entries()).containsOnlyKeys("/a.py");
        assertThat(server.blobStore.stat(storageKey)).isEmpty();
        assertThat(client.sync.cache().snapshot().orElseThrow().entries()).containsOnlyKeys("/a.py");
    }

    @Test
    void uploadFailure_abortsWithoutConfirmAndKeepsVersion() {
        InProcessWorkspaceSyncApi api = new InProcessWorkspaceSyncApi(server.service);
        UploadExecutor failing = new UploadExecutor((path, url, content) -> {
            throw new UploadFailureException(path, false, "network down", null);
        }, pool);
        WorkspaceSyncClient client = new WorkspaceSyncClient(workspaceId, api, failing, new LocalWorkspaceCache(server.clock), pool);

        RoundResult result = client.runRound(List.of(ClientFileState.file("/a.py", "a")), null);

        assertThat(result.finalState()).isEqualTo(RoundState.ABORTED);
        assertThat(result.transitions()).containsExactly(
                RoundState.DIFFING, RoundState.SYNCING, RoundState.UPLOADING, RoundState.ABORTED);
        assertThat(result.userMessage()).isEqualTo(WorkspaceSyncClient.MESSAGE_NOT_SAVED);
        assertThat(api.confirmCalls).hasValue(0);
        assertThat(serverRecord().version()).isEqualTo(1);
        assertThat(result.workspaceVersion()).isEqualTo(1);
    }

    @Test
    void staleView_syncConflictThenRetryReloadsAndSucceeds() {
        Client stale = client();
        Client other = client();
        stale.run(List.of());
        other.run(List.of(ClientFileState.file("/x.py", "x")));

        RoundResult conflict = stale.run(List.of(ClientFileState.file("/y.py", "y")));

        assertThat(conflict.transitions()).containsExactly(RoundState.DIFFING, RoundState.SYNCING, RoundState.ABORTED);
        assertThat(conflict.error()).isInstanceOfSatisfying(VersionConflictException.class,
                e -> assertThat(e.getCurrentVersion()).isEqualTo(2));
        assertThat(conflict.userMessage()).isEqualTo(WorkspaceSyncClient.MESSAGE_STALE_VIEW);

        int manifestCalls = stale.api.manifestCalls.get();
        RoundResult retry = stale.run(List.of(ClientFileState.file("/x.py", "x"), ClientFileState.file("/y.py", "y")));

        assertThat(stale.api.manifestCalls.get()).isEqualTo(manifestCalls + 1);
        assertThat(retry.isSuccess()).isTrue();
        assertThat(retry.workspaceVersion()).isEqualTo(3);
        assertThat(serverRecord().entries()).containsOnlyKeys("/x.py", "/y.py");
    }

    @Test
    void noChanges_goesStraightToExecution() {
        Client client = client();
        client.run(List.of(ClientFileState.file("/main.py", "print(1)")));

        RoundResult result = client.sync.runRound(List.of(ClientFileState.file("/main.py", "print(1)")),
                new ExecuteRequest("/main.py", "", "python"));

        assertThat(result.transitions()).containsExactly(RoundState.DIFFING, RoundState.EXECUTE);
        assertThat(result.jobId()).isNotBlank();
        assertThat(server.gateway.poll(result.jobId()).orElseThrow().workspaceVersion()).isEqualTo(2);
    }

    @Test
    void roundTrip_serverManifestMatchesLocalCacheAfterCommit() {
        Client client = client();

        client.run(List.of(
                ClientFileState.folder("/src"),
                ClientFileState.file("/src/app.py", "app"),
                ClientFileState.file("/README.md", "readme")));

        WorkspaceManifest manifest = server.service.manifest(workspaceId);
        Map<String, ManifestEntry> cached = client.sync.cache().snapshot().orElseThrow().entries();
        assertThat(manifest.workspaceVersion()).isEqualTo(client.sync.cache().snapshot().orElseThrow().version());
        assertThat(manifest.manifest()).extracting(ManifestEntry::filePath).containsExactlyElementsOf(cached.keySet());
        for (ManifestEntry entry : manifest.manifest()) {
            assertThat(entry.contentHash()).isEqualTo(cached.get(entry.filePath()).contentHash());
            assertThat(entry.size()).isEqualTo(cached.get(entry.filePath()).size());
            assertThat(entry.kind()).isEqualTo(cached.get(entry.filePath()).kind());
        }
    }

    @Test
    void repeatedUploadToSameCapability_storesSingleCopy() throws Exception {
        InProcessWorkspaceSyncApi api = new InProcessWorkspaceSyncApi(server.service);
        BlobUploader twice = (path, url, content) -> {
            server.upload(url, content);
            server.upload(url, content);
        };
        WorkspaceSyncClient client = new WorkspaceSyncClient(workspaceId, api, new UploadExecutor(twice, pool),
                new LocalWorkspaceCache(server.clock), pool);
        byte[] content = "print('twice')\n".getBytes(StandardCharsets.UTF_8);

        RoundResult result = client.runRound(List.of(ClientFileState.file("/main.py", content)), null);

        assertThat(result.isSuccess()).isTrue();
        try (InputStream in = server.blobStore.open(serverRecord().entries().get("/main.py").storageKey())) {
            assertThat(in.readAllBytes()).isEqualTo(content);
        }
    }

    @Test
    void runRoundAsync_completesWithRoundResult() throws Exception {
        Client client = client();

        RoundResult result = client.sync.runRoundAsync(List.of(ClientFileState.file("/a.py", "a")), null)
                .get(10, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.workspaceVersion()).isEqualTo(2);
    }

    @Test
    void cancel_duringUploadAbortsWithoutConfirm() throws Exception {
        CountDownLatch uploading = new CountDownLatch(1);
        InProcessWorkspaceSyncApi api = new InProcessWorkspaceSyncApi(server.service);
        WorkspaceSyncClient client = new WorkspaceSyncClient(workspaceId, api, new UploadExecutor(blockingUploader(uploading), pool),
                new LocalWorkspaceCache(server.clock), pool);
        assertThat(client.cancel()).isFalse();

        CompletableFuture<RoundResult> round = client.runRoundAsync(List.of(ClientFileState.file("/a.py", "a")), null);
        assertThat(uploading.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(client.cancel()).isTrue();
        RoundResult result = round.get(10, TimeUnit.SECONDS);

        assertThat(result.finalState()).isEqualTo(RoundState.ABORTED);
        assertThat(result.transitions()).containsExactly(
                RoundState.DIFFING, RoundState.SYNCING, RoundState.UPLOADING, RoundState.ABORTED);
        assertThat(result.userMessage()).isEqualTo(WorkspaceSyncClient.MESSAGE_CANCELLED);
        assertThat(api.confirmCalls).hasValue(0);
        assertThat(serverRecord().version()).isEqualTo(1);
        assertThat(client.state()).isEqualTo(RoundState.IDLE);
    }

    @Test
    void cancellingAsyncRoundFutureAbandonsTheRound() throws Exception {
        CountDownLatch uploading = new CountDownLatch(1);
        InProcessWorkspaceSyncApi api = new InProcessWorkspaceSyncApi(server.service);
        WorkspaceSyncClient client = new WorkspaceSyncClient(workspaceId, api, new UploadExecutor(blockingUploader(uploading), pool),
                new LocalWorkspaceCache(server.clock), pool);

        CompletableFuture<RoundResult> round = client.runRoundAsync(List.of(ClientFileState.file("/a.py", "a")), null);
        assertThat(uploading.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(round.cancel(true)).isTrue();

        // runRound 持有客户端监视器，拿到监视器即表示被取消的一轮已经结束
        synchronized (client) {
            assertThat(client.state()).isEqualTo(RoundState.IDLE);
        }
        assertThat(round.isCancelled()).isTrue();
        assertThat(api.confirmCalls).hasValue(0);
        assertThat(serverRecord().version()).isEqualTo(1);

        RoundResult next = client.runRound(List.of(), null);
        assertThat(next.isSuccess()).isTrue();
        assertThat(api.manifestCalls.get()).isEqualTo(2);
    }

    private static BlobUploader blockingUploader(CountDownLatch uploading) {
        CountDownLatch never = new CountDownLatch(1);
        return (path, url, content) -> {
            uploading.countDown();
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UploadFailureException(path, false, "上传被中断", e);
            }
            throw new UploadFailureException(path, false, "上传未被取消", null);
        };
    }

    private void prepareVersion3(Client client) {
        client.run(List.of(ClientFileState.file("/a.py", "H0")));
        client.run(List.of(ClientFileState.file("/a.py", "H1")));
    }

    private WorkspaceRecord serverRecord() {
        return server.metadataStore.find(workspaceId).orElseThrow();
    }

    private static Map<String, String> hashes(WorkspaceManifest manifest) {
        return manifest.manifest().stream().collect(Collectors.toMap(ManifestEntry::filePath, ManifestEntry::contentHash));
    }

    private Client client() {
        InProcessWorkspaceSyncApi api = new InProcessWorkspaceSyncApi(server.service);
        WorkspaceSyncClient sync = new WorkspaceSyncClient(workspaceId, api, new UploadExecutor(server.uploader(), pool),
                new LocalWorkspaceCache(server.clock), pool);
        return new Client(api, sync);
    }

    private record Client(InProcessWorkspaceSyncApi api, WorkspaceSyncClient sync) {

        RoundResult run(List<ClientFileState> files) {
            return sync.runRound(files, null);
        }
    }
}
