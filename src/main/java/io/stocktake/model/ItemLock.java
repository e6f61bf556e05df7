package io.stocktake.model;

public record ItemLock(
        String sessionId,
        String itemId,
        String counterId,
        long acquiredAtMs,
        long expiresAtMs
) {
    public boolean isExpired(long nowMs) {
        return nowMs >= expiresAtMs;
    }
}
