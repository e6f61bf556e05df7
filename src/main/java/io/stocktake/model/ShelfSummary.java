package io.stocktake.model;

import java.util.List;

public record ShelfSummary(
        String shelfLocation,
        int itemsCounted,
        int countEntries,
        List<String> counters,
        ShelfReviewStatus status,
        String reviewedBy,
        Long reviewedAtMs,
        String rejectionReason
) {
    public ShelfSummary {
        counters = counters == null ? List.of() : List.copyOf(counters);
    }
}
