package io.stocktake.lock;

import io.stocktake.error.ErrorKind;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.ItemLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Volatile, TTL-bounded exclusive claims on (session, item).
 *
 * <p>Every mutation of one key runs inside {@link ConcurrentHashMap#compute}, which is the
 * per-key critical section: acquire, release and the verify step of a count submission
 * are totally ordered for a key while unrelated keys proceed independently.
 *
 * <p>Expiry is cooperative. An expired claim stays in the table until the next access
 * to its key (or {@link #sweepExpired}) and is treated as absent meanwhile.
 *
 * <p>Each session also has a gate. Acquisition and submission run on its shared side,
 * lifecycle transitions on its exclusive side, so {@link #releaseAll} cannot interleave
 * with an in-flight acquire or submit.
 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final ConcurrentMap<LockKey, Claim> claims = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantReadWriteLock> gates = new ConcurrentHashMap<>();
    private final LongSupplier ttlMs;

    public LockManager(LongSupplier ttlMs) {
        this.ttlMs = ttlMs;
    }

    public <T> T underSharedGate(String sessionId, Supplier<T> action) {
        ReentrantReadWriteLock gate = gate(sessionId);
        gate.readLock().lock();
        try {
            return action.get();
        } finally {
            gate.readLock().unlock();
        }
    }

    public <T> T underExclusiveGate(String sessionId, Supplier<T> action) {
        ReentrantReadWriteLock gate = gate(sessionId);
        gate.writeLock().lock();
        try {
            return action.get();
        } finally {
            gate.writeLock().unlock();
        }
    }

    /**
     * Grants the claim, refreshes it when the same counter already holds it, or reclaims
     * it when the previous holder's claim has expired.
     *
     * @throws StockTakeException {@link ErrorKind#LOCK_HELD} when another counter holds
     *                            an unexpired claim
     */
    public ItemLock acquire(String sessionId, String itemId, String counterId, long nowMs) {
        LockKey key = new LockKey(sessionId, itemId);
        long expiresAt = nowMs + Math.max(1L, ttlMs.getAsLong());
        AtomicReference<ItemLock> conflict = new AtomicReference<>();
        Claim granted = claims.compute(key, (k, current) -> {
            if (current == null || current.isReclaimable(nowMs)) {
                if (current != null) {
                    log.debug("Reclaiming expired lock session={} item={} from={} to={}",
                            sessionId, itemId, current.lock().counterId(), counterId);
                }
                return new Claim(new ItemLock(sessionId, itemId, counterId, nowMs, expiresAt), false);
            }
            if (!current.lock().counterId().equals(counterId)) {
                conflict.set(current.lock());
                return current;
            }
            if (current.submitting()) {
                conflict.set(current.lock());
                return current;
            }
            return new Claim(new ItemLock(sessionId, itemId, counterId, nowMs, expiresAt), false);
        });
        ItemLock holder = conflict.get();
        if (holder != null) {
            throw new StockTakeException(ErrorKind.LOCK_HELD,
                    "Item " + itemId + " is being counted by " + holder.counterId(),
                    Map.of(
                            "session_id", sessionId,
                            "item_id", itemId,
                            "held_by", holder.counterId(),
                            "expires_at_ms", holder.expiresAtMs()
                    ));
        }
        return granted.lock();
    }

    /**
     * @throws StockTakeException {@link ErrorKind#NOT_HELD} when the counter does not hold
     *                            an unexpired claim on the item
     */
    public void release(String sessionId, String itemId, String counterId, long nowMs) {
        LockKey key = new LockKey(sessionId, itemId);
        AtomicReference<Boolean> released = new AtomicReference<>(false);
        claims.computeIfPresent(key, (k, current) -> {
            if (current.isReclaimable(nowMs)) {
                return null;
            }
            if (current.lock().counterId().equals(counterId) && !current.submitting()) {
                released.set(true);
                return null;
            }
            return current;
        });
        if (!released.get()) {
            throw new StockTakeException(ErrorKind.NOT_HELD,
                    counterId + " does not hold the lock on item " + itemId,
                    Map.of("session_id", sessionId, "item_id", itemId, "counter_id", counterId));
        }
    }

    /**
     * Verifies the counter's claim and runs {@code write} on success, consuming the claim.
     * The claim is parked in a submitting state while {@code write} runs, outside the key's
     * critical section; a failed write restores it.
     *
     * @throws StockTakeException {@link ErrorKind#LOCK_NOT_HELD} when the claim is absent,
     *                            expired, or held by someone else
     */
    public <T> T consume(String sessionId, String itemId, String counterId, long nowMs, Supplier<T> write) {
        LockKey key = new LockKey(sessionId, itemId);
        AtomicReference<Claim> parked = new AtomicReference<>();
        claims.computeIfPresent(key, (k, current) -> {
            if (current.isReclaimable(nowMs)) {
                return null;
            }
            if (!current.lock().counterId().equals(counterId) || current.submitting()) {
                return current;
            }
            Claim submitting = new Claim(current.lock(), true);
            parked.set(submitting);
            return submitting;
        });
        Claim claim = parked.get();
        if (claim == null) {
            throw new StockTakeException(ErrorKind.LOCK_NOT_HELD,
                    counterId + " does not hold a current lock on item " + itemId,
                    Map.of("session_id", sessionId, "item_id", itemId, "counter_id", counterId));
        }
        boolean written = false;
        try {
            T result = write.get();
            written = true;
            return result;
        } finally {
            boolean success = written;
            claims.computeIfPresent(key, (k, current) -> {
                if (current != claim) {
                    return current;
                }
                return success ? null : new Claim(claim.lock(), false);
            });
        }
    }

    /** Drops every claim of the session. Callers hold the exclusive gate. */
    public int releaseAll(String sessionId) {
        return underExclusiveGate(sessionId, () -> {
            int removed = 0;
            for (LockKey key : new ArrayList<>(claims.keySet())) {
                if (key.sessionId().equals(sessionId) && claims.remove(key) != null) {
                    removed++;
                }
            }
            return removed;
        });
    }

    /**
     * Drops every claim of the session and forgets its gate. For sessions that reached a
     * terminal state; threads already waiting on the old gate re-read the session status
     * once they get it.
     */
    public int retire(String sessionId) {
        int released = releaseAll(sessionId);
        gates.remove(sessionId);
        return released;
    }

    /** Forgets the gate without touching claims. */
    public void discardGate(String sessionId) {
        gates.remove(sessionId);
    }

    /** Sessions that currently have a gate. */
    public int gateCount() {
        return gates.size();
    }

    public List<ItemLock> activeLocks(String sessionId, long nowMs) {
        List<ItemLock> out = new ArrayList<>();
        for (Map.Entry<LockKey, Claim> e : claims.entrySet()) {
            if (e.getKey().sessionId().equals(sessionId) && !e.getValue().isReclaimable(nowMs)) {
                out.add(e.getValue().lock());
            }
        }
        out.sort(Comparator.comparingLong(ItemLock::acquiredAtMs).thenComparing(ItemLock::itemId));
        return out;
    }

    /** Optional active sweep; removes expired claims across all sessions. */
    public int sweepExpired(long nowMs) {
        int removed = 0;
        for (LockKey key : new ArrayList<>(claims.keySet())) {
            AtomicReference<Boolean> dropped = new AtomicReference<>(false);
            claims.computeIfPresent(key, (k, current) -> {
                if (current.isReclaimable(nowMs)) {
                    dropped.set(true);
                    return null;
                }
                return current;
            });
            if (dropped.get()) {
                removed++;
            }
        }
        return removed;
    }

    private ReentrantReadWriteLock gate(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("session id must not be null");
        }
        return gates.computeIfAbsent(sessionId, id -> new ReentrantReadWriteLock());
    }

    record LockKey(String sessionId, String itemId) {
    }

    private record Claim(ItemLock lock, boolean submitting) {
        // A claim mid-submission is never reclaimable: its write may still land.
        boolean isReclaimable(long nowMs) {
            return !submitting && lock.isExpired(nowMs);
        }
    }
}
