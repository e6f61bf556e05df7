package io.stocktake.error;

public enum ErrorKind {
    VALIDATION_ERROR(400, false),
    INVALID_TRANSITION(409, false),
    SESSION_NOT_ACTIVE(409, false),
    LOCK_HELD(423, true),
    LOCK_NOT_HELD(409, true),
    NOT_HELD(409, true),
    COUNTER_NOT_ALLOWED(403, true),
    ITEM_NOT_ASSIGNED(404, false),
    NOT_FOUND(404, false),
    INCOMPLETE_ITEMS(409, false),
    BRANCH_BUSY(409, false),
    PERMISSION_DENIED(403, false);

    private final int httpStatus;
    private final boolean retryable;

    ErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Contention kinds: the caller may retry after backoff. Everything else needs a
     * different request.
     */
    public boolean retryable() {
        return retryable;
    }
}
