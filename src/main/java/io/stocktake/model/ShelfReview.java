package io.stocktake.model;

/**
 * One reviewer decision on a shelf. Reviews are append-only; the latest one for a shelf
 * is its current status.
 */
public record ShelfReview(
        String reviewId,
        String sessionId,
        String shelfLocation,
        ShelfReviewStatus status,
        String reviewedBy,
        String rejectionReason,
        long reviewedAtMs,
        long sequence
) {
}
