package io.stocktake.model;

import java.util.List;

/** A shelf's summary with every count entry recorded on it, oldest first. */
public record ShelfDetail(
        ShelfSummary shelf,
        List<CountEntry> entries
) {
}
