package org.codesync.client;

import org.codesync.sync.HashingUtils;
import org.codesync.sync.SyncValidationException;
import org.codesync.sync.dto.ChangeAction;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.ManifestEntry;
import org.codesync.sync.dto.SyncFileClientState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestDifferTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ManifestDiffer differ = new ManifestDiffer();

    @Test
    void diff_classifiesNewModifiedDeletedAndSkipsUnchanged() {
        List<ManifestEntry> manifest = List.of(
                committed("/a.py", "a1"),
                committed("/same.py", "same"),
                committed("/gone.py", "g"),
                ManifestEntry.folder("/lib", "d1", NOW),
                ManifestEntry.folder("/old", "d2", NOW)
        );
        List<ClientFileState> files = List.of(
                ClientFileState.file("/a.py", "a2"),
                ClientFileState.file("/same.py", "same"),
                ClientFileState.file("/b.py", "b"),
                ClientFileState.folder("/lib"),
                ClientFileState.folder("/new")
        );

        Set<SyncFileClientState> changes = differ.diff(files, manifest);

        assertThat(changes).containsExactlyInAnyOrder(
                new SyncFileClientState("/a.py", EntryKind.FILE, ChangeAction.MODIFIED, HashingUtils.sha256Hex("a2")),
                new SyncFileClientState("/b.py", EntryKind.FILE, ChangeAction.NEW, HashingUtils.sha256Hex("b")),
                new SyncFileClientState("/new", EntryKind.FOLDER, ChangeAction.NEW, null),
                new SyncFileClientState("/gone.py", EntryKind.FILE, ChangeAction.DELETED, null),
                new SyncFileClientState("/old", EntryKind.FOLDER, ChangeAction.DELETED, null)
        );
    }

    @Test
    void diff_isIndependentOfInputOrder() {
        List<ManifestEntry> manifest = new ArrayList<>();
        List<ClientFileState> files = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            manifest.add(committed("/m" + i + ".py", "v" + i));
            if (i % 3 != 0) {
                files.add(ClientFileState.file("/m" + i + ".py", i % 2 == 0 ? "v" + i : "changed" + i));
            }
            files.add(ClientFileState.file("/n" + i + ".py", "n" + i));
        }
        Set<SyncFileClientState> expected = differ.diff(files, manifest);

        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            List<ManifestEntry> shuffledManifest = new ArrayList<>(manifest);
            List<ClientFileState> shuffledFiles = new ArrayList<>(files);
            Collections.shuffle(shuffledManifest, random);
            Collections.shuffle(shuffledFiles, random);

            assertThat(differ.diff(shuffledFiles, shuffledManifest)).isEqualTo(expected);
        }
    }

    @Test
    void diff_emptyWhenNothingChanged() {
        assertThat(differ.diff(List.of(ClientFileState.file("/a.py", "x")), List.of(committed("/a.py", "x")))).isEmpty();
    }

    @Test
    void diff_rejectsDuplicatePathsAndKindMismatch() {
        assertThatThrownBy(() -> differ.diff(
                List.of(ClientFileState.file("/a.py", "1"), ClientFileState.file("/a.py", "2")), List.of()))
                .isInstanceOf(SyncValidationException.class);
        assertThatThrownBy(() -> differ.diff(
                List.of(ClientFileState.folder("/a.py")), List.of(committed("/a.py", "1"))))
                .isInstanceOf(SyncValidationException.class);
    }

    private static ManifestEntry committed(String path, String content) {
        return ManifestEntry.file(path, "id" + path, "key", HashingUtils.sha256Hex(content), content.length(), NOW);
    }
}
