package io.stocktake.model;

/** A shelf is PENDING until a reviewer approves it or returns it to its counters. */
public enum ShelfReviewStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public static ShelfReviewStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Shelf review status must not be blank");
        }
        for (ShelfReviewStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown shelf review status: " + raw);
    }
}
