package io.stocktake.model;

import java.util.List;

public record CounterProgress(
        String counterId,
        List<String> assignedShelves,
        int itemsAssigned,
        int itemsCounted,
        double progressPercent
) {
}
