package io.stocktake.model;

import java.util.List;

public record VarianceReport(
        String sessionId,
        String sessionCode,
        String branchId,
        SessionStatus status,
        Long completedAtMs,
        boolean forceCompleted,
        int countedItems,
        int uncountedItems,
        long totalVariance,
        List<Row> rows
) {
    public record Row(
            String itemId,
            String shelfLocation,
            Long baselineQuantity,
            Long countedQuantity,
            Long variance,
            String countedBy,
            Long countedAtMs,
            int countEntries,
            boolean counted
    ) {
    }
}
