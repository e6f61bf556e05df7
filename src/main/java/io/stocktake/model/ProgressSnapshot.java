package io.stocktake.model;

import java.util.List;

public record ProgressSnapshot(
        String sessionId,
        String sessionCode,
        SessionStatus status,
        int totalItems,
        int totalCounted,
        double progressPercent,
        int activeLocks,
        List<CounterProgress> counters,
        List<CountEntry> recentCounts,
        long generatedAtMs,
        long pollIntervalMs
) {
}
