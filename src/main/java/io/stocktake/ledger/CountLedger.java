package io.stocktake.ledger;

import io.stocktake.error.StockTakeException;
import io.stocktake.lock.LockManager;
import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.storage.StockTakeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Writes count entries. A write is accepted only from the counter holding the item's
 * lock, and consumes that lock.
 */
public final class CountLedger {
    private static final Logger log = LoggerFactory.getLogger(CountLedger.class);
    private static final int MAX_NOTES_LENGTH = 2_000;

    private final StockTakeStore store;
    private final LockManager locks;
    private final LongSupplier maxQuantity;

    public CountLedger(StockTakeStore store, LockManager locks, LongSupplier maxQuantity) {
        this.store = store;
        this.locks = locks;
        this.maxQuantity = maxQuantity;
    }

    /**
     * Appends one entry. Variance is computed against the item's frozen baseline and
     * stored with the row.
     *
     * @param shelfLocation overrides the item's shelf when non-blank
     */
    public CountEntry record(
            String sessionId,
            String itemId,
            String counterId,
            long quantity,
            String shelfLocation,
            String notes,
            long nowMs
    ) {
        validateQuantity(quantity);
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw StockTakeException.validation("notes exceed " + MAX_NOTES_LENGTH + " characters");
        }
        AssignedItem item = store.findItem(sessionId, itemId)
                .orElseThrow(() -> StockTakeException.itemNotAssigned(sessionId, itemId));
        long baseline = item.baselineQuantity() == null ? 0L : item.baselineQuantity();
        String shelf = shelfLocation == null || shelfLocation.isBlank() ? item.shelfLocation() : shelfLocation.trim();
        CountEntry pending = new CountEntry(
                "cnt_" + UUID.randomUUID(),
                sessionId,
                itemId,
                counterId,
                quantity,
                baseline,
                quantity - baseline,
                shelf,
                notes == null || notes.isBlank() ? null : notes.trim(),
                nowMs,
                0L
        );
        CountEntry stored = locks.consume(sessionId, itemId, counterId, nowMs, () -> store.appendCount(pending));
        log.debug("Count recorded session={} item={} counter={} qty={} variance={}",
                sessionId, itemId, counterId, quantity, stored.variance());
        return stored;
    }

    public List<CountEntry> history(String sessionId, String counterId, int limit) {
        return store.listCounts(sessionId, counterId, limit);
    }

    private void validateQuantity(long quantity) {
        if (quantity < 0L) {
            throw StockTakeException.validation("counted quantity must not be negative: " + quantity);
        }
        long max = maxQuantity.getAsLong();
        if (quantity > max) {
            throw StockTakeException.validation("counted quantity " + quantity + " exceeds maximum " + max);
        }
    }
}
