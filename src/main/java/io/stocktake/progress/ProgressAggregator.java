package io.stocktake.progress;

import io.stocktake.error.StockTakeException;
import io.stocktake.lock.LockManager;
import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.CounterProgress;
import io.stocktake.model.ProgressSnapshot;
import io.stocktake.model.SessionView;
import io.stocktake.model.VarianceReport;
import io.stocktake.storage.StockTakeStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view over a session's ledger. Nothing computed here is stored.
 *
 * <p>An item counts as counted once it has any entry; only its latest entry is used for
 * quantity, variance and attribution, so recounts never move the overall percentage.
 *
 * <p>A counter's items are the ones on its shelves when the session carries a shelf map
 * entry for it, otherwise the items whose latest entry it wrote.
 */
public final class ProgressAggregator {
    private final StockTakeStore store;
    private final LockManager locks;

    public ProgressAggregator(StockTakeStore store, LockManager locks) {
        this.store = store;
        this.locks = locks;
    }

    public ProgressSnapshot snapshot(String sessionId, long nowMs, int recentLimit, long pollIntervalMs) {
        StockTakeStore.LedgerSnapshot ledger = store.snapshot(sessionId, recentLimit)
                .orElseThrow(() -> StockTakeException.notFound(sessionId));
        SessionView session = ledger.session();
        Map<String, CountEntry> latest = ledger.latestByItem();
        List<AssignedItem> items = ledger.items();

        int counted = 0;
        for (AssignedItem item : items) {
            if (latest.containsKey(item.itemId())) {
                counted++;
            }
        }

        List<CounterProgress> counters = new ArrayList<>();
        for (String counterId : countersOf(session, latest)) {
            List<String> shelves = session.assignedShelves().get(counterId);
            int assigned = 0;
            int done = 0;
            for (AssignedItem item : items) {
                CountEntry entry = latest.get(item.itemId());
                boolean mine;
                if (shelves != null) {
                    mine = item.shelfLocation() != null && shelves.contains(item.shelfLocation());
                } else {
                    mine = entry != null && counterId.equals(entry.counterId());
                }
                if (mine) {
                    assigned++;
                    if (entry != null) {
                        done++;
                    }
                }
            }
            counters.add(new CounterProgress(
                    counterId,
                    shelves == null ? List.of() : List.copyOf(shelves),
                    assigned,
                    done,
                    percent(done, assigned)
            ));
        }

        return new ProgressSnapshot(
                session.sessionId(),
                session.sessionCode(),
                session.status(),
                items.size(),
                counted,
                percent(counted, items.size()),
                locks.activeLocks(sessionId, nowMs).size(),
                counters,
                ledger.recentCounts(),
                nowMs,
                pollIntervalMs
        );
    }

    /** Per-item outcome, counted items first, then by item id. */
    public VarianceReport varianceReport(String sessionId) {
        StockTakeStore.LedgerSnapshot ledger = store.snapshot(sessionId, 1)
                .orElseThrow(() -> StockTakeException.notFound(sessionId));
        SessionView session = ledger.session();
        List<VarianceReport.Row> rows = new ArrayList<>();
        long totalVariance = 0L;
        int counted = 0;
        for (AssignedItem item : ledger.items()) {
            CountEntry entry = ledger.latestByItem().get(item.itemId());
            int entries = ledger.entryCountByItem().getOrDefault(item.itemId(), 0);
            if (entry == null) {
                rows.add(new VarianceReport.Row(item.itemId(), item.shelfLocation(), item.baselineQuantity(),
                        null, null, null, null, entries, false));
                continue;
            }
            counted++;
            totalVariance += entry.variance();
            rows.add(new VarianceReport.Row(
                    item.itemId(),
                    entry.shelfLocation() == null ? item.shelfLocation() : entry.shelfLocation(),
                    entry.baselineQuantity(),
                    entry.countedQuantity(),
                    entry.variance(),
                    entry.counterId(),
                    entry.countedAtMs(),
                    entries,
                    true
            ));
        }
        rows.sort(Comparator.comparing((VarianceReport.Row r) -> !r.counted()).thenComparing(VarianceReport.Row::itemId));
        return new VarianceReport(
                session.sessionId(),
                session.sessionCode(),
                session.branchId(),
                session.status(),
                session.completedAtMs(),
                session.forceCompleted(),
                counted,
                ledger.items().size() - counted,
                totalVariance,
                rows
        );
    }

    /** One decimal place; 0 when nothing is assigned. */
    public static double percent(int counted, int total) {
        if (total <= 0) {
            return 0.0d;
        }
        return Math.round(counted * 1000.0d / total) / 10.0d;
    }

    private static Set<String> countersOf(SessionView session, Map<String, CountEntry> latest) {
        Set<String> out = new LinkedHashSet<>(session.allowedCounters());
        out.addAll(new TreeSet<>(session.assignedShelves().keySet()));
        Set<String> writers = new TreeSet<>();
        for (CountEntry entry : latest.values()) {
            writers.add(entry.counterId());
        }
        out.addAll(writers);
        return out;
    }
}
