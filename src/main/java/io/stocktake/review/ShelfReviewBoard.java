package io.stocktake.review;

import io.stocktake.error.ErrorKind;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.CountEntry;
import io.stocktake.model.ShelfDetail;
import io.stocktake.model.ShelfReview;
import io.stocktake.model.ShelfReviewStatus;
import io.stocktake.model.ShelfSummary;
import io.stocktake.storage.StockTakeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Shelf-level review of submitted counts. Shelves are derived from the count ledger;
 * a shelf's status is its latest review, or PENDING when it has none. Recounting a shelf
 * does not reset its status.
 */
public final class ShelfReviewBoard {
    private static final Logger log = LoggerFactory.getLogger(ShelfReviewBoard.class);
    private static final int MAX_REASON_LENGTH = 2_000;

    private final StockTakeStore store;

    public ShelfReviewBoard(StockTakeStore store) {
        this.store = store;
    }

    /** Every shelf that has at least one count entry, ordered by shelf name. */
    public List<ShelfSummary> shelves(String sessionId) {
        StockTakeStore.ShelfLedger ledger = store.shelfLedger(sessionId);
        Map<String, List<CountEntry>> byShelf = new TreeMap<>();
        for (CountEntry e : ledger.shelvedEntries()) {
            byShelf.computeIfAbsent(e.shelfLocation(), k -> new ArrayList<>()).add(e);
        }
        Map<String, ShelfReview> latest = latestReviews(ledger.reviews());
        List<ShelfSummary> out = new ArrayList<>();
        for (Map.Entry<String, List<CountEntry>> e : byShelf.entrySet()) {
            out.add(summarize(e.getKey(), e.getValue(), latest.get(e.getKey())));
        }
        return out;
    }

    public ShelfDetail detail(String sessionId, String shelfLocation) {
        StockTakeStore.ShelfLedger ledger = store.shelfLedger(sessionId);
        List<CountEntry> entries = ledger.shelvedEntries().stream()
                .filter(e -> e.shelfLocation().equals(shelfLocation))
                .toList();
        if (entries.isEmpty()) {
            throw noCounts(sessionId, shelfLocation);
        }
        ShelfReview review = latestReviews(ledger.reviews()).get(shelfLocation);
        return new ShelfDetail(summarize(shelfLocation, entries, review), entries);
    }

    /**
     * Appends a decision for a shelf that has counts. A rejection needs a reason so the
     * counters know what to recount.
     */
    public ShelfSummary review(
            String sessionId,
            String shelfLocation,
            ShelfReviewStatus decision,
            String reviewer,
            String reason,
            long nowMs
    ) {
        if (decision == ShelfReviewStatus.PENDING) {
            throw StockTakeException.validation("a review must approve or reject the shelf");
        }
        String trimmedReason = reason == null ? null : reason.trim();
        if (decision == ShelfReviewStatus.REJECTED) {
            if (trimmedReason == null || trimmedReason.isEmpty()) {
                throw StockTakeException.validation("reason must not be blank when rejecting a shelf");
            }
            if (trimmedReason.length() > MAX_REASON_LENGTH) {
                throw StockTakeException.validation("reason exceeds " + MAX_REASON_LENGTH + " characters");
            }
        } else {
            trimmedReason = null;
        }
        List<CountEntry> entries = store.shelfLedger(sessionId).shelvedEntries().stream()
                .filter(e -> e.shelfLocation().equals(shelfLocation))
                .toList();
        if (entries.isEmpty()) {
            throw noCounts(sessionId, shelfLocation);
        }
        ShelfReview stored = store.appendShelfReview(new ShelfReview(
                "rev_" + UUID.randomUUID(),
                sessionId,
                shelfLocation,
                decision,
                reviewer,
                trimmedReason,
                nowMs,
                0L
        ));
        log.info("Shelf {} session={} shelf={} reviewer={} entries={}",
                decision.name().toLowerCase(), sessionId, shelfLocation, reviewer, entries.size());
        return summarize(shelfLocation, entries, stored);
    }

    private static Map<String, ShelfReview> latestReviews(List<ShelfReview> reviews) {
        Map<String, ShelfReview> latest = new HashMap<>();
        for (ShelfReview r : reviews) {
            latest.merge(r.shelfLocation(), r, (a, b) -> b.sequence() >= a.sequence() ? b : a);
        }
        return latest;
    }

    private static ShelfSummary summarize(String shelf, List<CountEntry> entries, ShelfReview review) {
        Set<String> items = new HashSet<>();
        Set<String> counters = new TreeSet<>();
        for (CountEntry e : entries) {
            items.add(e.itemId());
            counters.add(e.counterId());
        }
        if (review == null) {
            return new ShelfSummary(shelf, items.size(), entries.size(), List.copyOf(counters),
                    ShelfReviewStatus.PENDING, null, null, null);
        }
        return new ShelfSummary(shelf, items.size(), entries.size(), List.copyOf(counters),
                review.status(), review.reviewedBy(), review.reviewedAtMs(), review.rejectionReason());
    }

    private static StockTakeException noCounts(String sessionId, String shelfLocation) {
        return new StockTakeException(ErrorKind.NOT_FOUND,
                "No counts found for shelf '" + shelfLocation + "'",
                Map.of("session_id", sessionId, "shelf_location", shelfLocation));
    }
}
