package io.stocktake.storage;

import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.ShelfReview;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Volatile store for tests and embedded use. A single read/write lock gives snapshot
 * reads the same point-in-time guarantee as the SQLite read transaction.
 */
public final class InMemoryStockTakeStore implements StockTakeStore {
    private static final Comparator<CountEntry> NEWEST_FIRST = Comparator
            .comparingLong(CountEntry::countedAtMs)
            .thenComparingLong(CountEntry::sequence)
            .reversed();

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Map<String, SessionView> sessions = new LinkedHashMap<>();
    private final Map<String, TreeMap<String, AssignedItem>> items = new HashMap<>();
    private final Map<String, List<CountEntry>> ledger = new HashMap<>();
    private final Map<String, List<ShelfReview>> reviews = new HashMap<>();
    private long nextSequence = 1L;
    private long nextReviewSequence = 1L;

    @Override
    public void init() {
    }

    @Override
    public boolean insertSessionIfBranchIdle(SessionView session, List<AssignedItem> newItems) {
        rw.writeLock().lock();
        try {
            boolean busy = sessions.values().stream()
                    .anyMatch(s -> s.branchId().equals(session.branchId()) && !s.status().isTerminal());
            if (busy || sessions.containsKey(session.sessionId()) || codeTaken(session.sessionCode())) {
                return false;
            }
            TreeMap<String, AssignedItem> byId = new TreeMap<>();
            for (AssignedItem item : newItems) {
                byId.put(item.itemId(), item);
            }
            items.put(session.sessionId(), byId);
            ledger.put(session.sessionId(), new ArrayList<>());
            sessions.put(session.sessionId(), withItemCount(session, byId.size()));
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public boolean sessionCodeExists(String sessionCode) {
        rw.readLock().lock();
        try {
            return codeTaken(sessionCode);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<SessionView> findSession(String sessionId) {
        rw.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<SessionView> findSessionByCode(String sessionCode) {
        rw.readLock().lock();
        try {
            return sessions.values().stream()
                    .filter(s -> s.sessionCode().equalsIgnoreCase(sessionCode == null ? "" : sessionCode.trim()))
                    .findFirst();
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<SessionView> listSessions(String branchId, SessionStatus status, int limit) {
        rw.readLock().lock();
        try {
            return sessions.values().stream()
                    .filter(s -> branchId == null || branchId.isBlank() || s.branchId().equals(branchId))
                    .filter(s -> status == null || s.status() == status)
                    .sorted(Comparator.comparingLong(SessionView::createdAtMs)
                            .thenComparing(SessionView::sessionId)
                            .reversed())
                    .limit(Math.max(1, limit))
                    .toList();
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public boolean transition(StatusTransition t) {
        rw.writeLock().lock();
        try {
            SessionView s = sessions.get(t.sessionId());
            if (s == null || s.status() != t.from()) {
                return false;
            }
            long now = t.nowMs();
            boolean starting = t.from() == SessionStatus.DRAFT && t.to() == SessionStatus.ACTIVE;
            sessions.put(s.sessionId(), new SessionView(
                    s.sessionId(), s.sessionCode(), s.branchId(), s.createdBy(), s.multiUser(),
                    s.allowedCounters(), s.assignedShelves(), s.notes(), t.to(), t.forceCompleted(),
                    s.createdAtMs(), now,
                    starting ? Long.valueOf(now) : s.startedAtMs(),
                    t.to() == SessionStatus.PAUSED ? Long.valueOf(now) : s.pausedAtMs(),
                    t.to() == SessionStatus.COMPLETED ? Long.valueOf(now) : s.completedAtMs(),
                    t.to() == SessionStatus.CANCELLED ? Long.valueOf(now) : s.cancelledAtMs(),
                    s.itemCount()
            ));
            TreeMap<String, AssignedItem> byId = items.get(s.sessionId());
            for (Map.Entry<String, Long> e : t.baselines().entrySet()) {
                AssignedItem item = byId.get(e.getKey());
                if (item != null && !item.baselineFrozen()) {
                    byId.put(item.itemId(), new AssignedItem(item.sessionId(), item.itemId(), e.getValue(),
                            item.shelfLocation(), now));
                }
            }
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public boolean updateSessionDetails(String sessionId, SessionUpdate update, long nowMs) {
        rw.writeLock().lock();
        try {
            SessionView s = sessions.get(sessionId);
            if (s == null || s.status().isTerminal()) {
                return false;
            }
            sessions.put(sessionId, new SessionView(
                    s.sessionId(), s.sessionCode(), s.branchId(), s.createdBy(), s.multiUser(),
                    update.allowedCounters() == null ? s.allowedCounters() : update.allowedCounters(),
                    update.assignedShelves() == null ? s.assignedShelves() : update.assignedShelves(),
                    update.notes() == null ? s.notes() : update.notes(),
                    s.status(), s.forceCompleted(), s.createdAtMs(), nowMs,
                    s.startedAtMs(), s.pausedAtMs(), s.completedAtMs(), s.cancelledAtMs(), s.itemCount()
            ));
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public List<AssignedItem> listItems(String sessionId) {
        rw.readLock().lock();
        try {
            TreeMap<String, AssignedItem> byId = items.get(sessionId);
            return byId == null ? List.of() : List.copyOf(byId.values());
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<AssignedItem> findItem(String sessionId, String itemId) {
        rw.readLock().lock();
        try {
            TreeMap<String, AssignedItem> byId = items.get(sessionId);
            return byId == null ? Optional.empty() : Optional.ofNullable(byId.get(itemId));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public CountEntry appendCount(CountEntry e) {
        rw.writeLock().lock();
        try {
            TreeMap<String, AssignedItem> byId = items.get(e.sessionId());
            if (byId == null || !byId.containsKey(e.itemId())) {
                throw new IllegalStateException("No assigned item " + e.itemId() + " in session " + e.sessionId());
            }
            CountEntry stored = new CountEntry(e.entryId(), e.sessionId(), e.itemId(), e.counterId(),
                    e.countedQuantity(), e.baselineQuantity(), e.variance(), e.shelfLocation(), e.notes(),
                    e.countedAtMs(), nextSequence++);
            ledger.get(e.sessionId()).add(stored);
            return stored;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public List<CountEntry> listCounts(String sessionId, String counterId, int limit) {
        rw.readLock().lock();
        try {
            return ledger.getOrDefault(sessionId, List.of()).stream()
                    .filter(e -> counterId == null || counterId.isBlank() || e.counterId().equals(counterId))
                    .sorted(NEWEST_FIRST)
                    .limit(Math.max(1, limit))
                    .toList();
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<LedgerSnapshot> snapshot(String sessionId, int recentLimit) {
        rw.readLock().lock();
        try {
            SessionView session = sessions.get(sessionId);
            if (session == null) {
                return Optional.empty();
            }
            List<CountEntry> entries = ledger.getOrDefault(sessionId, List.of());
            Map<String, CountEntry> latest = new LinkedHashMap<>();
            Map<String, Integer> entryCounts = new HashMap<>();
            for (CountEntry e : entries) {
                latest.put(e.itemId(), e);
                entryCounts.merge(e.itemId(), 1, Integer::sum);
            }
            List<CountEntry> recent = entries.stream()
                    .sorted(NEWEST_FIRST)
                    .limit(Math.max(1, recentLimit))
                    .toList();
            return Optional.of(new LedgerSnapshot(session, List.copyOf(items.get(sessionId).values()),
                    latest, entryCounts, recent));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public ShelfReview appendShelfReview(ShelfReview r) {
        rw.writeLock().lock();
        try {
            if (!sessions.containsKey(r.sessionId())) {
                throw new IllegalStateException("No session " + r.sessionId());
            }
            ShelfReview stored = new ShelfReview(r.reviewId(), r.sessionId(), r.shelfLocation(), r.status(),
                    r.reviewedBy(), r.rejectionReason(), r.reviewedAtMs(), nextReviewSequence++);
            reviews.computeIfAbsent(r.sessionId(), id -> new ArrayList<>()).add(stored);
            return stored;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public ShelfLedger shelfLedger(String sessionId) {
        rw.readLock().lock();
        try {
            List<CountEntry> shelved = ledger.getOrDefault(sessionId, List.of()).stream()
                    .filter(e -> e.shelfLocation() != null)
                    .toList();
            return new ShelfLedger(shelved, List.copyOf(reviews.getOrDefault(sessionId, List.of())));
        } finally {
            rw.readLock().unlock();
        }
    }

    private boolean codeTaken(String sessionCode) {
        return sessions.values().stream().anyMatch(s -> s.sessionCode().equalsIgnoreCase(sessionCode));
    }

    private static SessionView withItemCount(SessionView s, int itemCount) {
        return new SessionView(s.sessionId(), s.sessionCode(), s.branchId(), s.createdBy(), s.multiUser(),
                s.allowedCounters(), s.assignedShelves(), s.notes(), s.status(), s.forceCompleted(),
                s.createdAtMs(), s.updatedAtMs(), s.startedAtMs(), s.pausedAtMs(), s.completedAtMs(),
                s.cancelledAtMs(), itemCount);
    }
}
