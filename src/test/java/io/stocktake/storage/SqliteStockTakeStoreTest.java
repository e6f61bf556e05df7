package io.stocktake.storage;

import io.stocktake.config.StockTakeConfig;
import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.ShelfReview;
import io.stocktake.model.ShelfReviewStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SqliteStockTakeStoreTest {

    @Test
    void secondOpenSessionForBranchIsRejected() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-branch-busy-");
        try {
            SqliteStockTakeStore store = newStore(root);
            long now = 1_700_000_000_000L;
            Assertions.assertTrue(store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now),
                    List.of(item("s1", "i1", 10L, "A1"))));
            Assertions.assertFalse(store.insertSessionIfBranchIdle(draft("s2", "ST-JAN01B", "br-1", now + 1),
                    List.of(item("s2", "i1", 10L, "A1"))));
            Assertions.assertTrue(store.findSession("s2").isEmpty());
            Assertions.assertTrue(store.insertSessionIfBranchIdle(draft("s3", "ST-JAN01C", "br-2", now + 2),
                    List.of(item("s3", "i1", null, null))));

            Assertions.assertTrue(store.transition(new StockTakeStore.StatusTransition(
                    "s1", SessionStatus.DRAFT, SessionStatus.CANCELLED, now + 3, false, Map.of())));
            Assertions.assertTrue(store.insertSessionIfBranchIdle(draft("s4", "ST-JAN01D", "br-1", now + 4),
                    List.of(item("s4", "i9", 1L, null))));

            List<SessionView> branch1 = store.listSessions("br-1", null, 10);
            Assertions.assertEquals(List.of("s4", "s1"), branch1.stream().map(SessionView::sessionId).toList());
            Assertions.assertEquals(1, store.listSessions(null, SessionStatus.CANCELLED, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transitionIsCompareAndSetAndFreezesMissingBaselines() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-transition-");
        try {
            SqliteStockTakeStore store = newStore(root);
            long now = 1_700_000_000_000L;
            store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now),
                    List.of(item("s1", "i1", 10L, "A1"), item("s1", "i2", null, "A2")));

            Assertions.assertFalse(store.transition(new StockTakeStore.StatusTransition(
                    "s1", SessionStatus.ACTIVE, SessionStatus.PAUSED, now + 1, false, Map.of())));
            Assertions.assertTrue(store.transition(new StockTakeStore.StatusTransition(
                    "s1", SessionStatus.DRAFT, SessionStatus.ACTIVE, now + 2, false, Map.of("i2", 7L))));
            Assertions.assertFalse(store.transition(new StockTakeStore.StatusTransition(
                    "s1", SessionStatus.DRAFT, SessionStatus.ACTIVE, now + 3, false, Map.of("i2", 99L))));

            SessionView active = store.findSession("s1").orElseThrow();
            Assertions.assertEquals(SessionStatus.ACTIVE, active.status());
            Assertions.assertEquals(Long.valueOf(now + 2), active.startedAtMs());
            Assertions.assertEquals(2, active.itemCount());

            AssignedItem i1 = store.findItem("s1", "i1").orElseThrow();
            AssignedItem i2 = store.findItem("s1", "i2").orElseThrow();
            Assertions.assertEquals(10L, i1.baselineQuantity());
            Assertions.assertEquals(7L, i2.baselineQuantity());
            Assertions.assertEquals(Long.valueOf(now + 2), i2.baselineFrozenAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ledgerRowsAndBaselinesCannotBeRewritten() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-append-only-");
        try {
            StockTakeConfig config = StockTakeConfig.fromRoot(root.toString());
            Database db = new Database(config);
            SqliteStockTakeStore store = new SqliteStockTakeStore(db);
            store.init();
            long now = 1_700_000_000_000L;
            store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now), List.of(item("s1", "i1", 10L, "A1")));
            CountEntry stored = store.appendCount(entry("e1", "s1", "i1", "alice", 8L, 10L, now + 5));
            Assertions.assertTrue(stored.sequence() > 0L);

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("UPDATE count_entries SET counted_quantity=1 WHERE entry_id='e1'"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("DELETE FROM count_entries WHERE entry_id='e1'"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("UPDATE session_items SET baseline_quantity=3 WHERE item_id='i1'"));
            }
            Assertions.assertThrows(RuntimeException.class,
                    () -> store.appendCount(entry("e2", "s1", "not-assigned", "alice", 1L, 0L, now + 6)));
            Assertions.assertEquals(1, store.listCounts("s1", null, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void snapshotUsesLatestEntryPerItemAndOrdersRecentNewestFirst() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-snapshot-");
        try {
            SqliteStockTakeStore store = newStore(root);
            long now = 1_700_000_000_000L;
            store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now),
                    List.of(item("s1", "i1", 10L, "A1"), item("s1", "i2", 5L, "A2")));
            store.appendCount(entry("e1", "s1", "i1", "alice", 8L, 10L, now + 1));
            store.appendCount(entry("e2", "s1", "i2", "bob", 5L, 5L, now + 2));
            store.appendCount(entry("e3", "s1", "i1", "bob", 9L, 10L, now + 3));

            StockTakeStore.LedgerSnapshot snap = store.snapshot("s1", 2).orElseThrow();
            Assertions.assertEquals(2, snap.items().size());
            Assertions.assertEquals("e3", snap.latestByItem().get("i1").entryId());
            Assertions.assertEquals(2, snap.entryCountByItem().get("i1"));
            Assertions.assertEquals(List.of("e3", "e2"), snap.recentCounts().stream().map(CountEntry::entryId).toList());

            List<CountEntry> bobs = store.listCounts("s1", "bob", 10);
            Assertions.assertEquals(List.of("e3", "e2"), bobs.stream().map(CountEntry::entryId).toList());
            Assertions.assertTrue(store.snapshot("missing", 5).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detailsUpdateAndCodeLookup() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-details-");
        try {
            SqliteStockTakeStore store = newStore(root);
            long now = 1_700_000_000_000L;
            store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now), List.of(item("s1", "i1", 1L, null)));

            Assertions.assertTrue(store.sessionCodeExists("st-jan01a"));
            Assertions.assertEquals("s1", store.findSessionByCode(" st-jan01a ").orElseThrow().sessionId());

            Assertions.assertTrue(store.updateSessionDetails("s1",
                    new SessionUpdate(List.of("alice", "bob"), Map.of("alice", List.of("A1")), null), now + 1));
            SessionView updated = store.findSession("s1").orElseThrow();
            Assertions.assertEquals(List.of("alice", "bob"), updated.allowedCounters());
            Assertions.assertEquals(List.of("A1"), updated.assignedShelves().get("alice"));
            Assertions.assertEquals("weekly count", updated.notes());

            store.transition(new StockTakeStore.StatusTransition(
                    "s1", SessionStatus.DRAFT, SessionStatus.CANCELLED, now + 2, false, Map.of()));
            Assertions.assertFalse(store.updateSessionDetails("s1", new SessionUpdate(null, null, "late"), now + 3));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shelfLedgerKeepsShelvedEntriesAndReviewsInOrder() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-shelf-ledger-");
        try {
            StockTakeConfig config = StockTakeConfig.fromRoot(root.toString());
            Database db = new Database(config);
            SqliteStockTakeStore store = new SqliteStockTakeStore(db);
            store.init();
            long now = 1_700_000_000_000L;
            store.insertSessionIfBranchIdle(draft("s1", "ST-JAN01A", "br-1", now),
                    List.of(item("s1", "i1", 10L, "A1"), item("s1", "i2", 5L, null)));
            store.appendCount(shelved("e1", "i1", "A1", now + 1));
            store.appendCount(entry("e2", "s1", "i2", "bob", 5L, 5L, now + 2));
            store.appendCount(shelved("e3", "i1", "A1", now + 3));

            ShelfReview first = store.appendShelfReview(review("r1", ShelfReviewStatus.REJECTED, "short by one", now + 4));
            ShelfReview second = store.appendShelfReview(review("r2", ShelfReviewStatus.APPROVED, null, now + 5));
            Assertions.assertTrue(second.sequence() > first.sequence());

            StockTakeStore.ShelfLedger ledger = store.shelfLedger("s1");
            Assertions.assertEquals(List.of("e1", "e3"), ledger.shelvedEntries().stream().map(CountEntry::entryId).toList());
            Assertions.assertEquals(List.of("r1", "r2"), ledger.reviews().stream().map(ShelfReview::reviewId).toList());
            Assertions.assertEquals("short by one", ledger.reviews().get(0).rejectionReason());
            Assertions.assertTrue(store.shelfLedger("missing").reviews().isEmpty());

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("UPDATE shelf_reviews SET status='APPROVED' WHERE review_id='r1'"));
                Assertions.assertThrows(SQLException.class,
                        () -> st.executeUpdate("DELETE FROM shelf_reviews WHERE review_id='r1'"));
            }
            Assertions.assertThrows(RuntimeException.class,
                    () -> store.appendShelfReview(new ShelfReview("r3", "missing", "A1", ShelfReviewStatus.APPROVED,
                            "sup", null, now + 6, 0L)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void schemaMigrationsAreRecordedOnce() throws Exception {
        Path root = Files.createTempDirectory("stocktake-test-migrations-");
        try {
            Database db = new Database(StockTakeConfig.fromRoot(root.toString()));
            db.init();
            db.init();
            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations(10);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertTrue(rows.stream().allMatch(Database.SchemaMigrationRow::success));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SqliteStockTakeStore newStore(Path root) {
        SqliteStockTakeStore store = new SqliteStockTakeStore(new Database(StockTakeConfig.fromRoot(root.toString())));
        store.init();
        return store;
    }

    static SessionView draft(String id, String code, String branch, long now) {
        return new SessionView(id, code, branch, "manager", true, List.of(), Map.of(), "weekly count",
                SessionStatus.DRAFT, false, now, now, null, null, null, null, 0);
    }

    static AssignedItem item(String sessionId, String itemId, Long baseline, String shelf) {
        return new AssignedItem(sessionId, itemId, baseline, shelf, null);
    }

    static CountEntry entry(String id, String sessionId, String itemId, String counter, long qty, long baseline, long at) {
        return new CountEntry(id, sessionId, itemId, counter, qty, baseline, qty - baseline, null, null, at, 0L);
    }

    static CountEntry shelved(String id, String itemId, String shelf, long at) {
        return new CountEntry(id, "s1", itemId, "alice", 9L, 10L, -1L, shelf, null, at, 0L);
    }

    static ShelfReview review(String id, ShelfReviewStatus status, String reason, long at) {
        return new ShelfReview(id, "s1", "A1", status, "sup", reason, at, 0L);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
