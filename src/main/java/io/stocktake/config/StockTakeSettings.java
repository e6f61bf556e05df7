package io.stocktake.config;

import io.stocktake.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables read from {@code stocktake-settings.json}. Absent fields keep their defaults.
 */
public record StockTakeSettings(
        long lockTtlMs,
        int recentCountLimit,
        long pollIntervalMs,
        long maxQuantity
) {
    public static final long DEFAULT_LOCK_TTL_MS = 5L * 60L * 1_000L;
    public static final int DEFAULT_RECENT_COUNT_LIMIT = 20;
    public static final long DEFAULT_POLL_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_MAX_QUANTITY = 1_000_000_000L;

    public static StockTakeSettings defaults() {
        return new StockTakeSettings(
                DEFAULT_LOCK_TTL_MS,
                DEFAULT_RECENT_COUNT_LIMIT,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_MAX_QUANTITY
        );
    }

    public static StockTakeSettings load(Path file) {
        StockTakeSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load stock take settings: " + file, e);
        }
    }

    static StockTakeSettings fromFile(SettingsFile file, StockTakeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long ttl = file.lockTtlMs() == null ? defaults.lockTtlMs() : Math.max(1_000L, file.lockTtlMs());
        int recent = file.recentCountLimit() == null
                ? defaults.recentCountLimit()
                : Math.max(1, Math.min(500, file.recentCountLimit()));
        long poll = file.pollIntervalMs() == null ? defaults.pollIntervalMs() : Math.max(500L, file.pollIntervalMs());
        long maxQty = file.maxQuantity() == null ? defaults.maxQuantity() : Math.max(0L, file.maxQuantity());
        return new StockTakeSettings(ttl, recent, poll, maxQty);
    }

    public List<String> diff(StockTakeSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return List.of("lockTtlMs", "recentCountLimit", "pollIntervalMs", "maxQuantity");
        }
        if (lockTtlMs != other.lockTtlMs) {
            changed.add("lockTtlMs");
        }
        if (recentCountLimit != other.recentCountLimit) {
            changed.add("recentCountLimit");
        }
        if (pollIntervalMs != other.pollIntervalMs) {
            changed.add("pollIntervalMs");
        }
        if (maxQuantity != other.maxQuantity) {
            changed.add("maxQuantity");
        }
        return changed;
    }

    record SettingsFile(
            Long lockTtlMs,
            Integer recentCountLimit,
            Long pollIntervalMs,
            Long maxQuantity
    ) {
    }
}
