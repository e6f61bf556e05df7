package io.stocktake.model;

import java.util.List;
import java.util.Map;

public record SessionView(
        String sessionId,
        String sessionCode,
        String branchId,
        String createdBy,
        boolean multiUser,
        List<String> allowedCounters,
        Map<String, List<String>> assignedShelves,
        String notes,
        SessionStatus status,
        boolean forceCompleted,
        long createdAtMs,
        long updatedAtMs,
        Long startedAtMs,
        Long pausedAtMs,
        Long completedAtMs,
        Long cancelledAtMs,
        int itemCount
) {
    public SessionView {
        allowedCounters = allowedCounters == null ? List.of() : List.copyOf(allowedCounters);
        assignedShelves = assignedShelves == null ? Map.of() : Map.copyOf(assignedShelves);
    }

    public boolean isCounterAllowed(String counterId) {
        return allowedCounters.isEmpty() || allowedCounters.contains(counterId);
    }
}
