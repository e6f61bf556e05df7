package io.stocktake.model;

import java.util.List;
import java.util.Map;

/** Null fields are left unchanged. */
public record SessionUpdate(
        List<String> allowedCounters,
        Map<String, List<String>> assignedShelves,
        String notes
) {
}
