package io.stocktake.model;

import java.util.List;
import java.util.Map;

/**
 * Caller input for creating a session. Items without a baseline quantity get one from
 * the item catalog when the session starts.
 */
public record NewSession(
        String branchId,
        String createdBy,
        boolean multiUser,
        List<String> allowedCounters,
        Map<String, List<String>> assignedShelves,
        String notes,
        List<ItemSeed> items
) {
}
