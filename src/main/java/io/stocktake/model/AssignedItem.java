package io.stocktake.model;

/**
 * An item in scope for one session. {@code baselineQuantity} is null until the
 * session is started, after which it never changes.
 */
public record AssignedItem(
        String sessionId,
        String itemId,
        Long baselineQuantity,
        String shelfLocation,
        Long baselineFrozenAtMs
) {
    public boolean baselineFrozen() {
        return baselineQuantity != null;
    }
}
