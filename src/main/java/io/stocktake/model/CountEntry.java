package io.stocktake.model;

public record CountEntry(
        String entryId,
        String sessionId,
        String itemId,
        String counterId,
        long countedQuantity,
        long baselineQuantity,
        long variance,
        String shelfLocation,
        String notes,
        long countedAtMs,
        long sequence
) {
}
