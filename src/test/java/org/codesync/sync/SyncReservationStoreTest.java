package org.codesync.sync;

import org.codesync.sync.Reservation.Committed;
import org.codesync.sync.Reservation.Pending;
import org.codesync.sync.Reservation.ReservedAction;
import org.codesync.sync.dto.ConfirmAction;
import org.codesync.sync.dto.EntryKind;
import org.codesync.sync.dto.FileAction;
import org.codesync.sync.dto.RequiredAction;
import org.codesync.sync.dto.SyncAction;
import org.codesync.sync.store.InMemoryMetadataStore;
import org.codesync.sync.store.WorkspaceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncReservationStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryMetadataStore metadataStore = new InMemoryMetadataStore();
    private final SyncReservationStore store = new SyncReservationStore(metadataStore, Duration.ofMinutes(20), clock);

    @BeforeEach
    void setUp() {
        metadataStore.create(WorkspaceRecord.create("w1", "demo", "alice", clock.instant(), 3));
    }

    @Test
    void reserve_persistsPendingInWorkspaceDocument() {
        Pending pending = store.reserve("w1", 3, actions("/main.py", "k1", "hash"));

        assertThat(pending.provisionalVersion()).isEqualTo(4);
        assertThat(metadataStore.find("w1").orElseThrow().reservations()).containsEntry(pending.reservationId(), pending);
        assertThat(store.find("w1", pending.reservationId())).contains(pending);
        assertThat(store.find("w1", null)).isEmpty();
        assertThat(store.find("w2", pending.reservationId())).isEmpty();
        assertThat(metadataStore.find("w1").orElseThrow().version()).isEqualTo(3);
    }

    @Test
    void reserve_unknownWorkspaceFails() {
        assertThatThrownBy(() -> store.reserve("missing", 1, actions("/a.py", "k", "hash")))
                .isInstanceOf(WorkspaceNotFoundException.class);
    }

    @Test
    void match_requiresWholeActionSet() {
        Pending mine = store.reserve("w1", 3, actions("/a.py", "k-mine", "hash-mine"));
        Pending theirs = store.reserve("w1", 3, actions("/a.py", "k-theirs", "hash-theirs"));
        WorkspaceRecord record = metadataStore.find("w1").orElseThrow();

        assertThat(store.match(record, 4, finalized("/a.py", "k-mine", "hash-mine"))).contains(mine);
        assertThat(store.match(record, 4, finalized("/a.py", "k-theirs", "HASH-THEIRS"))).contains(theirs);
        assertThat(store.match(record, 4, finalized("/a.py", "k-mine", "hash-theirs"))).isEmpty();
        assertThat(store.match(record, 5, finalized("/a.py", "k-mine", "hash-mine"))).isEmpty();
    }

    @Test
    void match_prefersLivePendingOverExpired() {
        Pending expired = store.reserve("w1", 3, actions("/a.py", "k", "hash"));
        clock.advance(Duration.ofMinutes(21));

        WorkspaceRecord record = metadataStore.find("w1").orElseThrow();
        assertThat(store.match(record, 4, finalized("/a.py", "k", "hash"))).contains(expired);

        Pending live = store.reserve("w1", 3, actions("/a.py", "k", "hash"));
        record = metadataStore.find("w1").orElseThrow();
        assertThat(store.match(record, 4, finalized("/a.py", "k", "hash"))).contains(live);
    }

    @Test
    void expiredReservation_isStillDistinguishableUntilGracePeriodEnds() {
        Pending pending = store.reserve("w1", 3, actions("/a.py", "k1", "hash"));
        clock.advance(Duration.ofMinutes(21));

        assertThat(store.find("w1", pending.reservationId())).get()
                .isInstanceOfSatisfying(Pending.class, p -> assertThat(p.isExpiredAt(clock.instant())).isTrue());

        clock.advance(Duration.ofMinutes(25));
        store.reserve("w1", 3, actions("/b.py", "k2", "hash"));
        assertThat(store.find("w1", pending.reservationId())).isEmpty();
        assertThat(store.size("w1")).isEqualTo(1);
    }

    @Test
    void markCommitted_replacesPendingInsideTheCommittedDocument() {
        Pending pending = store.reserve("w1", 3, actions("/a.py", "k1", "hash"));

        metadataStore.compareAndSet("w1", 3,
                current -> store.markCommitted(current.withManifest(4, current.entries()), pending));

        WorkspaceRecord record = metadataStore.find("w1").orElseThrow();
        assertThat(record.version()).isEqualTo(4);
        assertThat(store.find(record, pending.reservationId())).get()
                .isInstanceOfSatisfying(Committed.class, c -> assertThat(c.version()).isEqualTo(4));
        assertThat(store.match(record, 4, finalized("/a.py", "k1", "hash"))).get().isInstanceOf(Committed.class);
    }

    @Test
    void reservationsAreVisibleToAnotherStoreOnSameMetadata() {
        SyncReservationStore other = new SyncReservationStore(metadataStore, Duration.ofMinutes(20), clock);
        Pending pending = store.reserve("w1", 3, actions("/a.py", "k1", "hash"));

        assertThat(other.find("w1", pending.reservationId())).contains(pending);
    }

    private static Map<String, ReservedAction> actions(String path, String storageKey, String hash) {
        SyncAction action = new SyncAction(path, EntryKind.FILE, "f-" + path, storageKey, RequiredAction.UPLOAD, null, null, null);
        return Map.of(path, new ReservedAction(action, hash));
    }

    private static Map<String, FileAction> finalized(String path, String storageKey, String hash) {
        return Map.of(path, new FileAction(path, "f-" + path, storageKey, ConfirmAction.UPSERT, EntryKind.FILE, hash, 1L));
    }
}
