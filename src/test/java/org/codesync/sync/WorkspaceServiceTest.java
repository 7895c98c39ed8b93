package org.codesync.sync;

import org.codesync.sync.dto.ChangeAction;
import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.ConfirmSyncRequest;
import org.codesync.sync.dto.CreateWorkspaceRequest;
import org.codesync.sync.dto.CreateWorkspaceResult;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.ExecuteRequest;
import org.codesync.sync.dto.ExecuteResult;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.dto.SyncFileClientState;
import org.codesync.sync.dto.SyncRequest;
import org.codesync.sync.dto.SyncResponse;
import org.codesync.sync.dto.WorkspaceManifest;
import org.codesync.sync.dto.WorkspaceSummary;
import org.codesync.sync.execution.JobState;
import org.codesync.sync.store.WorkspaceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceServiceTest {

    private static final byte[] MAIN = "print('hi')\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private ServerFixture server;

    @BeforeEach
    void setUp() {
        server = new ServerFixture(root);
    }

    @Test
    void create_startsAtInitialVersionWithCreatorAsMember() {
        CreateWorkspaceResult created = server.service.create(new CreateWorkspaceRequest("  demo ", "alice"));

        assertThat(created.initialVersion()).isEqualTo(WorkspaceService.INITIAL_VERSION);
        assertThat(created.name()).isEqualTo("demo");
        assertThat(server.metadataStore.find(created.workspaceId()).orElseThrow().members()).containsExactly("alice");
        assertThat(server.service.manifest(created.workspaceId()).manifest()).isEmpty();
        assertThatThrownBy(() -> server.service.create(new CreateWorkspaceRequest(" ", "alice")))
                .isInstanceOf(SyncValidationException.class);
    }

    @Test
    void manifest_attachesDownloadUrlsToFilesOnly() {
        String workspaceId = server.createWorkspace();
        commitMainAndFolder(workspaceId);

        WorkspaceManifest manifest = server.service.manifest(workspaceId);

        assertThat(manifest.workspaceVersion()).isEqualTo(2);
        assertThat(manifest.manifest()).extracting(ManifestEntry::filePath).containsExactly("/main.py", "/src");
        assertThat(manifest.manifest().get(0).downloadUrl()).startsWith("http://sync.test/blobs?");
        assertThat(manifest.manifest().get(1).downloadUrl()).isNull();
    }

    @Test
    void execute_targetsCommittedVersion() {
        String workspaceId = server.createWorkspace();
        commitMainAndFolder(workspaceId);

        ExecuteResult result = server.service.execute(workspaceId, new ExecuteRequest("/main.py", "", null));

        assertThat(result.workspaceVersion()).isEqualTo(2);
        assertThat(server.service.jobStatus(result.jobId()).state()).isEqualTo(JobState.QUEUED);
        assertThat(server.service.jobStatus(result.jobId()).language()).isEqualTo("python");
    }

    @Test
    void execute_rejectsMissingEntrypointFolderOrUnsupportedLanguage() {
        String workspaceId = server.createWorkspace();
        commitMainAndFolder(workspaceId);

        assertThatThrownBy(() -> server.service.execute(workspaceId, new ExecuteRequest("/other.py", null, null)))
                .isInstanceOf(SyncValidationException.class);
        assertThatThrownBy(() -> server.service.execute(workspaceId, new ExecuteRequest("/src", null, null)))
                .isInstanceOf(SyncValidationException.class);
        assertThatThrownBy(() -> server.service.execute(workspaceId, new ExecuteRequest("/main.py", null, "cobol")))
                .isInstanceOf(SyncValidationException.class);
        assertThatThrownBy(() -> server.service.jobStatus("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void listWorkspaces_returnsOwnedAndSharedWorkspacesWithRole() {
        String owned = server.createWorkspace();
        server.clock.advance(Duration.ofMinutes(1));
        server.metadataStore.create(new WorkspaceRecord("shared", "team", "bob", server.clock.instant(), 1,
                List.of("bob", "alice"), Map.of(), Map.of()));
        server.service.create(new CreateWorkspaceRequest("private", "carol"));

        List<WorkspaceSummary> workspaces = server.service.listWorkspaces("alice");

        assertThat(workspaces).extracting(WorkspaceSummary::workspaceId).containsExactly(owned, "shared");
        assertThat(workspaces).extracting(WorkspaceSummary::userRole)
                .containsExactly(WorkspaceService.ROLE_OWNER, WorkspaceService.ROLE_MEMBER);
        assertThat(server.service.listWorkspaces("nobody")).isEmpty();
        assertThatThrownBy(() -> server.service.listWorkspaces(" ")).isInstanceOf(SyncValidationException.class);
    }

    @Test
    void nonMemberIsDeniedAndNothingChanges() {
        String workspaceId = server.createWorkspace();
        SyncRequest request = new SyncRequest(1L, List.of(
                new SyncFileClientState("/main.py", EntryKind.FILE, ChangeAction.NEW, HashingUtils.sha256Hex(MAIN))));

        assertThatThrownBy(() -> server.service.manifest(workspaceId, "mallory"))
                .isInstanceOfSatisfying(WorkspaceAccessDeniedException.class,
                        e -> assertThat(e.getUserId()).isEqualTo("mallory"));
        assertThatThrownBy(() -> server.service.sync(workspaceId, "mallory", request))
                .isInstanceOf(WorkspaceAccessDeniedException.class);
        assertThatThrownBy(() -> server.service.confirm(workspaceId, "mallory",
                new ConfirmSyncRequest(2L, null, List.of())))
                .isInstanceOf(WorkspaceAccessDeniedException.class);
        assertThatThrownBy(() -> server.service.execute(workspaceId, "mallory", new ExecuteRequest("/main.py", null, null)))
                .isInstanceOf(WorkspaceAccessDeniedException.class);
        assertThat(server.reservations.size(workspaceId)).isZero();

        SyncResponse allowed = server.service.sync(workspaceId, "alice", request);
        assertThat(allowed.reservationId()).isNotBlank();
        assertThat(server.service.manifest(workspaceId, "alice").workspaceVersion()).isEqualTo(1);
    }

    private void commitMainAndFolder(String workspaceId) {
        SyncResponse sync = server.service.sync(workspaceId, new SyncRequest(1L, List.of(
                new SyncFileClientState("/main.py", EntryKind.FILE, ChangeAction.NEW, HashingUtils.sha256Hex(MAIN)),
                new SyncFileClientState("/src", EntryKind.FOLDER, ChangeAction.NEW, null))));
        SyncAction file = sync.actions().get(0);
        SyncAction folder = sync.actions().get(1);
        server.upload(file.uploadCapability(), MAIN);
        server.service.confirm(workspaceId, new ConfirmSyncRequest(sync.provisionalVersion(), sync.reservationId(), List.of(
                new FileAction("/main.py", file.fileId(), file.storageKey(), ConfirmAction.UPSERT, EntryKind.FILE,
                        HashingUtils.sha256Hex(MAIN), (long) MAIN.length),
                new FileAction("/src", folder.fileId(), null, ConfirmAction.UPSERT, EntryKind.FOLDER, null, null))));
    }
}
