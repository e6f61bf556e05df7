package io.stocktake.error;

import java.util.List;
import java.util.Map;

public final class StockTakeException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;

    public StockTakeException(ErrorKind kind, String message) {
        this(kind, message, Map.of());
    }

    public StockTakeException(ErrorKind kind, String message, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    public static StockTakeException validation(String message) {
        return new StockTakeException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static StockTakeException notFound(String sessionId) {
        return new StockTakeException(ErrorKind.NOT_FOUND, "Session not found: " + sessionId,
                Map.of("session_id", String.valueOf(sessionId)));
    }

    public static StockTakeException itemNotAssigned(String sessionId, String itemId) {
        return new StockTakeException(ErrorKind.ITEM_NOT_ASSIGNED,
                "Item " + itemId + " is not assigned to session " + sessionId,
                Map.of("session_id", sessionId, "item_id", String.valueOf(itemId)));
    }

    public static StockTakeException incompleteItems(String sessionId, List<String> missingItemIds) {
        return new StockTakeException(ErrorKind.INCOMPLETE_ITEMS,
                missingItemIds.size() + " item(s) have not been counted in session " + sessionId,
                Map.of("session_id", sessionId, "missing_item_ids", List.copyOf(missingItemIds)));
    }
}
