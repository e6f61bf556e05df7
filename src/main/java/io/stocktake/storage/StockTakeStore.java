package io.stocktake.storage;

import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.ShelfReview;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable home of sessions, assigned items and the count ledger. Locks are not stored
 * here; they live in {@link io.stocktake.lock.LockManager}.
 *
 * <p>Implementations must make {@link #transition} a compare-and-set on the current
 * status, keep count entries append-only, and never change a baseline once set.
 */
public interface StockTakeStore {

    void init();

    /**
     * Inserts the session and its items unless the branch already has a DRAFT, ACTIVE or
     * PAUSED session. Returns false in that case and writes nothing.
     */
    boolean insertSessionIfBranchIdle(SessionView session, List<AssignedItem> items);

    boolean sessionCodeExists(String sessionCode);

    Optional<SessionView> findSession(String sessionId);

    Optional<SessionView> findSessionByCode(String sessionCode);

    /** Newest first. A null branch or status means no filter. */
    List<SessionView> listSessions(String branchId, SessionStatus status, int limit);

    boolean transition(StatusTransition transition);

    /** Applies the non-null fields of the update to a non-terminal session. */
    boolean updateSessionDetails(String sessionId, SessionUpdate update, long nowMs);

    List<AssignedItem> listItems(String sessionId);

    Optional<AssignedItem> findItem(String sessionId, String itemId);

    /** Returns the stored entry with its ledger sequence assigned. */
    CountEntry appendCount(CountEntry entry);

    /** Newest first. A null counter means every counter. */
    List<CountEntry> listCounts(String sessionId, String counterId, int limit);

    /** Session, items and ledger read as one point-in-time view. */
    Optional<LedgerSnapshot> snapshot(String sessionId, int recentLimit);

    /** Returns the stored review with its sequence assigned. */
    ShelfReview appendShelfReview(ShelfReview review);

    /**
     * Count entries that carry a shelf location and every shelf review of the session,
     * both oldest first, read as one point-in-time view.
     */
    ShelfLedger shelfLedger(String sessionId);

    record StatusTransition(
            String sessionId,
            SessionStatus from,
            SessionStatus to,
            long nowMs,
            boolean forceCompleted,
            Map<String, Long> baselines
    ) {
        public StatusTransition {
            baselines = baselines == null ? Map.of() : Map.copyOf(baselines);
        }
    }

    record LedgerSnapshot(
            SessionView session,
            List<AssignedItem> items,
            Map<String, CountEntry> latestByItem,
            Map<String, Integer> entryCountByItem,
            List<CountEntry> recentCounts
    ) {
    }

    record ShelfLedger(
            List<CountEntry> shelvedEntries,
            List<ShelfReview> reviews
    ) {
    }
}
