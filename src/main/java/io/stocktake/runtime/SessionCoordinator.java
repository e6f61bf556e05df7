package io.stocktake.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.stocktake.catalog.ItemCatalog;
import io.stocktake.catalog.MapItemCatalog;
import io.stocktake.config.StockTakeConfig;
import io.stocktake.config.StockTakeSettings;
import io.stocktake.error.ErrorKind;
import io.stocktake.error.StockTakeException;
import io.stocktake.ledger.CountLedger;
import io.stocktake.lock.LockManager;
import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.ItemLock;
import io.stocktake.model.ItemSeed;
import io.stocktake.model.NewSession;
import io.stocktake.model.ProgressSnapshot;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.ShelfDetail;
import io.stocktake.model.ShelfReviewStatus;
import io.stocktake.model.ShelfSummary;
import io.stocktake.model.VarianceReport;
import io.stocktake.observability.AuditLogger;
import io.stocktake.progress.ProgressAggregator;
import io.stocktake.review.ShelfReviewBoard;
import io.stocktake.session.SessionStateMachine;
import io.stocktake.session.StartPermission;
import io.stocktake.storage.Database;
import io.stocktake.storage.SqliteStockTakeStore;
import io.stocktake.storage.StockTakeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for every stock take operation. Composes the store, the lock table, the
 * count ledger and the progress aggregator, and writes the audit trail.
 *
 * <p>Lifecycle transitions run under the session's exclusive gate; lock acquisition,
 * count submission and shelf reviews run under its shared side. A gate is only created
 * for a session that exists and is not terminal, and is dropped once the session
 * completes or is cancelled.
 */
public final class SessionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);
    private static final int MAX_SUFFIX_ROUNDS = 100;

    private final StockTakeConfig config;
    private final Database database;
    private final StockTakeStore store;
    private final LockManager locks;
    private final CountLedger ledger;
    private final ProgressAggregator progress;
    private final ShelfReviewBoard shelfReviews;
    private final StartPermission startPermission;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final boolean catalogFromFile;
    private final Object createLock;
    private volatile ItemCatalog catalog;
    private volatile StockTakeSettings settings;

    public SessionCoordinator(StockTakeConfig config) {
        this(config, new Database(config), null, StartPermission.ALLOW_ALL, Clock.systemUTC());
    }

    public SessionCoordinator(
            StockTakeConfig config,
            StockTakeStore store,
            ItemCatalog catalog,
            StartPermission startPermission,
            Clock clock
    ) {
        this(config, null, store, catalog, startPermission, clock);
    }

    SessionCoordinator(
            StockTakeConfig config,
            Database database,
            ItemCatalog catalog,
            StartPermission startPermission,
            Clock clock
    ) {
        this(config, database, new SqliteStockTakeStore(database), catalog, startPermission, clock);
    }

    private SessionCoordinator(
            StockTakeConfig config,
            Database database,
            StockTakeStore store,
            ItemCatalog catalog,
            StartPermission startPermission,
            Clock clock
    ) {
        this.config = config;
        this.database = database;
        this.store = store;
        this.settings = StockTakeSettings.defaults();
        this.locks = new LockManager(() -> settings.lockTtlMs());
        this.ledger = new CountLedger(store, locks, () -> settings.maxQuantity());
        this.progress = new ProgressAggregator(store, locks);
        this.shelfReviews = new ShelfReviewBoard(store);
        this.startPermission = startPermission == null ? StartPermission.ALLOW_ALL : startPermission;
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace());
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.catalogFromFile = catalog == null;
        this.catalog = catalog == null ? ItemCatalog.EMPTY : catalog;
        this.createLock = new Object();
    }

    public void init() {
        store.init();
        loadSettings();
        if (catalogFromFile) {
            catalog = MapItemCatalog.load(config.catalogFile());
        }
    }

    public StockTakeSettings settings() {
        return settings;
    }

    public SettingsReloadOutcome reloadSettings() {
        SettingsReloadOutcome out = loadSettings();
        if (catalogFromFile) {
            catalog = MapItemCatalog.load(config.catalogFile());
        }
        return out;
    }

    // ---------------------------------------------------------------- sessions

    public SessionView createSession(NewSession request) {
        validateNewSession(request);
        long now = clock.millis();
        List<String> allowed = normalizeCounters(request.allowedCounters());
        Map<String, List<String>> shelves = normalizeShelves(request.assignedShelves());
        validateShelfOwners(allowed, shelves);
        String sessionId = "sst_" + UUID.randomUUID();
        List<AssignedItem> items = new ArrayList<>();
        for (ItemSeed seed : request.items()) {
            items.add(new AssignedItem(sessionId, seed.itemId().trim(), seed.baselineQuantity(),
                    blankToNull(seed.shelfLocation()), null));
        }
        String branchId = request.branchId().trim();
        synchronized (createLock) {
            String code = nextSessionCode(now);
            SessionView draft = new SessionView(
                    sessionId,
                    code,
                    branchId,
                    request.createdBy().trim(),
                    request.multiUser(),
                    allowed,
                    shelves,
                    blankToNull(request.notes()),
                    SessionStatus.DRAFT,
                    false,
                    now,
                    now,
                    null,
                    null,
                    null,
                    null,
                    items.size()
            );
            if (!store.insertSessionIfBranchIdle(draft, items)) {
                String open = store.listSessions(branchId, null, 20).stream()
                        .filter(s -> !s.status().isTerminal())
                        .map(SessionView::sessionCode)
                        .findFirst()
                        .orElse("");
                auditLogger.log(AuditLogger.AuditEvent.of("session.create", draft.createdBy(), "rejected", null,
                        Map.of("branch_id", branchId, "reason", "branch_busy", "open_session_code", open)));
                throw new StockTakeException(ErrorKind.BRANCH_BUSY,
                        "Branch " + branchId + " already has an open session " + open,
                        Map.of("branch_id", branchId, "open_session_code", open));
            }
        }
        auditLogger.log(AuditLogger.AuditEvent.of("session.create", request.createdBy().trim(), "success", sessionId,
                Map.of("branch_id", branchId, "item_count", items.size(), "multi_user", request.multiUser())));
        log.info("Created stock take session id={} branch={} items={}", sessionId, branchId, items.size());
        return requireSession(sessionId);
    }

    public SessionView startSession(String sessionId, String actor) {
        return transition(sessionId, actor, EnumSet.of(SessionStatus.DRAFT), SessionStatus.ACTIVE, false,
                "session.start");
    }

    public SessionView pauseSession(String sessionId, String actor) {
        return transition(sessionId, actor, EnumSet.of(SessionStatus.ACTIVE), SessionStatus.PAUSED, false,
                "session.pause");
    }

    public SessionView resumeSession(String sessionId, String actor) {
        return transition(sessionId, actor, EnumSet.of(SessionStatus.PAUSED), SessionStatus.ACTIVE, false,
                "session.resume");
    }

    /**
     * @param force complete even when items are uncounted; they stay absent from the
     *              ledger and the session is flagged force-completed
     */
    public SessionView completeSession(String sessionId, String actor, boolean force) {
        return transition(sessionId, actor, EnumSet.of(SessionStatus.ACTIVE, SessionStatus.PAUSED),
                SessionStatus.COMPLETED, force, "session.complete");
    }

    public SessionView cancelSession(String sessionId, String actor) {
        return transition(sessionId, actor,
                EnumSet.of(SessionStatus.DRAFT, SessionStatus.ACTIVE, SessionStatus.PAUSED),
                SessionStatus.CANCELLED, false, "session.cancel");
    }

    public SessionView updateSession(String sessionId, String actor, SessionUpdate update) {
        String who = requireText(actor, "actor");
        if (update == null) {
            throw StockTakeException.validation("update must not be null");
        }
        SessionView before = requireSession(sessionId);
        if (before.status().isTerminal()) {
            throw notEditable(before);
        }
        return locks.underExclusiveGate(sessionId, () -> {
            SessionView current = requireSessionInGate(sessionId);
            if (current.status().isTerminal()) {
                throw notEditable(current);
            }
            List<String> allowed = update.allowedCounters() == null ? null : normalizeCounters(update.allowedCounters());
            Map<String, List<String>> shelves = update.assignedShelves() == null
                    ? null
                    : normalizeShelves(update.assignedShelves());
            validateShelfOwners(allowed == null ? current.allowedCounters() : allowed,
                    shelves == null ? current.assignedShelves() : shelves);
            if (!current.multiUser() && allowed != null && allowed.size() > 1) {
                throw StockTakeException.validation("single-user session allows at most one counter");
            }
            SessionUpdate normalized = new SessionUpdate(allowed, shelves,
                    update.notes() == null ? null : update.notes().trim());
            if (!store.updateSessionDetails(sessionId, normalized, clock.millis())) {
                throw new StockTakeException(ErrorKind.INVALID_TRANSITION,
                        "Session " + current.sessionCode() + " can no longer be edited",
                        Map.of("session_id", sessionId));
            }
            List<String> fields = new ArrayList<>();
            if (allowed != null) {
                fields.add("allowed_counters");
            }
            if (shelves != null) {
                fields.add("assigned_shelves");
            }
            if (update.notes() != null) {
                fields.add("notes");
            }
            auditLogger.log(AuditLogger.AuditEvent.of("session.update", who, "success", sessionId,
                    Map.of("fields", fields)));
            return requireSession(sessionId);
        });
    }

    /**
     * Adds a counter to an ACTIVE multi-user session found by its code. Sessions with an
     * unrestricted counter list are joined without change.
     */
    public SessionView joinSession(String sessionCode, String counterId) {
        String counter = requireText(counterId, "counter");
        SessionView byCode = store.findSessionByCode(requireText(sessionCode, "session code"))
                .orElseThrow(() -> new StockTakeException(ErrorKind.NOT_FOUND,
                        "No session with code " + sessionCode, Map.of("session_code", sessionCode)));
        if (!byCode.multiUser()) {
            throw StockTakeException.validation("Session " + byCode.sessionCode() + " is single-user");
        }
        SessionStateMachine.requireActive(byCode);
        return locks.underExclusiveGate(byCode.sessionId(), () -> {
            SessionView session = requireSessionInGate(byCode.sessionId());
            if (!session.multiUser()) {
                throw StockTakeException.validation("Session " + session.sessionCode() + " is single-user");
            }
            SessionStateMachine.requireActive(session);
            if (session.allowedCounters().isEmpty() || session.allowedCounters().contains(counter)) {
                return session;
            }
            List<String> allowed = new ArrayList<>(session.allowedCounters());
            allowed.add(counter);
            store.updateSessionDetails(session.sessionId(), new SessionUpdate(allowed, null, null), clock.millis());
            auditLogger.log(AuditLogger.AuditEvent.of("session.join", counter, "success", session.sessionId(),
                    Map.of("session_code", session.sessionCode())));
            return requireSession(session.sessionId());
        });
    }

    public SessionView getSession(String sessionId) {
        return requireSession(sessionId);
    }

    public Optional<SessionView> findSession(String sessionId) {
        return store.findSession(sessionId);
    }

    public SessionView getSessionByCode(String sessionCode) {
        return store.findSessionByCode(requireText(sessionCode, "session code"))
                .orElseThrow(() -> new StockTakeException(ErrorKind.NOT_FOUND,
                        "No session with code " + sessionCode, Map.of("session_code", sessionCode)));
    }

    public List<SessionView> listSessions(String branchId, String status, int limit) {
        SessionStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = SessionStatus.fromString(status);
            } catch (IllegalArgumentException e) {
                throw StockTakeException.validation(e.getMessage());
            }
        }
        return store.listSessions(branchId, filter, Math.max(1, Math.min(500, limit)));
    }

    // ---------------------------------------------------------------- locks and counts

    public ItemLock acquireLock(String sessionId, String itemId, String counterId) {
        String counter = requireText(counterId, "counter");
        String item = requireText(itemId, "item");
        SessionStateMachine.requireActive(requireSession(sessionId));
        return locks.underSharedGate(sessionId, () -> {
            SessionView session = requireSessionInGate(sessionId);
            SessionStateMachine.requireActive(session);
            if (!session.isCounterAllowed(counter)) {
                throw new StockTakeException(ErrorKind.COUNTER_NOT_ALLOWED,
                        counter + " is not allowed to count in session " + session.sessionCode(),
                        Map.of("session_id", sessionId, "counter_id", counter));
            }
            if (store.findItem(sessionId, item).isEmpty()) {
                throw StockTakeException.itemNotAssigned(sessionId, item);
            }
            try {
                return locks.acquire(sessionId, item, counter, clock.millis());
            } catch (StockTakeException e) {
                auditLogger.log(AuditLogger.AuditEvent.ofItem("lock.acquire", counter, "conflict", sessionId, item,
                        e.details()));
                throw e;
            }
        });
    }

    public ReleaseOutcome releaseLock(String sessionId, String itemId, String counterId) {
        requireSession(sessionId);
        String counter = requireText(counterId, "counter");
        String item = requireText(itemId, "item");
        locks.release(sessionId, item, counter, clock.millis());
        return new ReleaseOutcome(sessionId, item, counter, true);
    }

    public CountEntry submitCount(String sessionId, String itemId, String counterId, long quantity) {
        return submitCount(sessionId, itemId, counterId, quantity, null, null);
    }

    public CountEntry submitCount(
            String sessionId,
            String itemId,
            String counterId,
            long quantity,
            String shelfLocation,
            String notes
    ) {
        String counter = requireText(counterId, "counter");
        String item = requireText(itemId, "item");
        SessionStateMachine.requireActive(requireSession(sessionId));
        return locks.underSharedGate(sessionId, () -> {
            SessionStateMachine.requireActive(requireSessionInGate(sessionId));
            CountEntry entry = ledger.record(sessionId, item, counter, quantity, shelfLocation, notes, clock.millis());
            auditLogger.log(AuditLogger.AuditEvent.ofItem("count.submit", counter, "success", sessionId, item,
                    Map.of(
                            "entry_id", entry.entryId(),
                            "counted_quantity", entry.countedQuantity(),
                            "baseline_quantity", entry.baselineQuantity(),
                            "variance", entry.variance()
                    )));
            return entry;
        });
    }

    public List<ItemLock> listLocks(String sessionId) {
        requireSession(sessionId);
        return locks.activeLocks(sessionId, clock.millis());
    }

    /** Ledger history, newest first; a blank counter lists every counter's entries. */
    public List<CountEntry> listCounts(String sessionId, String counterId, int limit) {
        requireSession(sessionId);
        return ledger.history(sessionId, blankToNull(counterId), Math.max(1, Math.min(1_000, limit)));
    }

    public ProgressSnapshot getProgress(String sessionId) {
        requireSessionId(sessionId);
        StockTakeSettings current = settings;
        return progress.snapshot(sessionId, clock.millis(), current.recentCountLimit(), current.pollIntervalMs());
    }

    public VarianceReport varianceReport(String sessionId) {
        requireSessionId(sessionId);
        return progress.varianceReport(sessionId);
    }

    public int sweepExpiredLocks() {
        int removed = locks.sweepExpired(clock.millis());
        if (removed > 0) {
            log.debug("Swept {} expired lock(s)", removed);
        }
        return removed;
    }

    // ---------------------------------------------------------------- shelf review

    public List<ShelfSummary> listShelves(String sessionId) {
        requireSession(sessionId);
        return shelfReviews.shelves(sessionId);
    }

    /** One shelf's summary and its count entries, oldest first. */
    public ShelfDetail shelfCounts(String sessionId, String shelfLocation) {
        String shelf = requireText(shelfLocation, "shelf");
        requireSession(sessionId);
        return shelfReviews.detail(sessionId, shelf);
    }

    public ShelfSummary approveShelf(String sessionId, String shelfLocation, String actor) {
        return reviewShelf(sessionId, shelfLocation, actor, ShelfReviewStatus.APPROVED, null, "shelf.approve");
    }

    public ShelfSummary rejectShelf(String sessionId, String shelfLocation, String actor, String reason) {
        return reviewShelf(sessionId, shelfLocation, actor, ShelfReviewStatus.REJECTED, reason, "shelf.reject");
    }

    /** Sessions currently holding a lock gate. */
    public int openGates() {
        return locks.gateCount();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database == null ? List.of() : database.listSchemaMigrations(limit);
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(Math.max(1, limit));
    }

    public AuditIntegrityOutcome verifyAudit() {
        try {
            int rows = auditLogger.verify();
            return new AuditIntegrityOutcome(true, rows, auditLogger.currentHash(), "ok");
        } catch (IllegalStateException e) {
            log.warn("Audit chain verification failed: {}", e.getMessage());
            return new AuditIntegrityOutcome(false, 0, auditLogger.currentHash(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------- internals

    private ShelfSummary reviewShelf(
            String sessionId,
            String shelfLocation,
            String actor,
            ShelfReviewStatus decision,
            String reason,
            String action
    ) {
        String who = requireText(actor, "actor");
        String shelf = requireText(shelfLocation, "shelf");
        SessionStateMachine.requireActive(requireSession(sessionId));
        return locks.underSharedGate(sessionId, () -> {
            SessionStateMachine.requireActive(requireSessionInGate(sessionId));
            ShelfSummary out = shelfReviews.review(sessionId, shelf, decision, who, reason, clock.millis());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("shelf_location", shelf);
            details.put("count_entries", out.countEntries());
            if (out.rejectionReason() != null) {
                details.put("reason", out.rejectionReason());
            }
            auditLogger.log(AuditLogger.AuditEvent.of(action, who, "success", sessionId, details));
            return out;
        });
    }

    private SessionView transition(
            String sessionId,
            String actor,
            Set<SessionStatus> from,
            SessionStatus to,
            boolean force,
            String action
    ) {
        String who = requireText(actor, "actor");
        SessionView before = requireSession(sessionId);
        if (before.status().isTerminal()) {
            throw invalidTransition(before, to);
        }
        return locks.underExclusiveGate(sessionId, () -> {
            SessionView session = requireSessionInGate(sessionId);
            if (!from.contains(session.status())) {
                throw invalidTransition(session, to);
            }
            SessionStateMachine.requireTransition(session, to);
            long now = clock.millis();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", session.status().name());
            details.put("to", to.name());
            Map<String, Long> baselines = Map.of();
            boolean forced = false;
            if (session.status() == SessionStatus.DRAFT && to == SessionStatus.ACTIVE) {
                if (!startPermission.mayStart(who, session)) {
                    auditLogger.log(AuditLogger.AuditEvent.of(action, who, "denied", sessionId, details));
                    throw new StockTakeException(ErrorKind.PERMISSION_DENIED,
                            who + " may not start session " + session.sessionCode(),
                            Map.of("session_id", sessionId, "actor", who));
                }
                baselines = resolveBaselines(session);
                details.put("baselines_frozen", baselines.size());
            }
            if (to == SessionStatus.COMPLETED) {
                List<String> missing = uncountedItems(sessionId);
                if (!missing.isEmpty() && !force) {
                    throw StockTakeException.incompleteItems(sessionId, missing);
                }
                forced = !missing.isEmpty();
                details.put("force_completed", forced);
                if (forced) {
                    details.put("uncounted_item_ids", missing);
                }
            }
            boolean moved = store.transition(new StockTakeStore.StatusTransition(
                    sessionId, session.status(), to, now, forced, baselines));
            if (!moved) {
                SessionView latest = requireSession(sessionId);
                throw new StockTakeException(ErrorKind.INVALID_TRANSITION,
                        "Session " + latest.sessionCode() + " changed concurrently; now " + latest.status(),
                        Map.of("session_id", sessionId, "status", latest.status().name()));
            }
            if (to.isTerminal()) {
                details.put("locks_released", locks.retire(sessionId));
            } else if (SessionStateMachine.releasesLocks(to)) {
                details.put("locks_released", locks.releaseAll(sessionId));
            }
            auditLogger.log(AuditLogger.AuditEvent.of(action, who, "success", sessionId, details));
            log.info("Session {} moved {} -> {} by {}", sessionId, session.status(), to, who);
            return requireSession(sessionId);
        });
    }

    private Map<String, Long> resolveBaselines(SessionView session) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (AssignedItem item : store.listItems(session.sessionId())) {
            if (item.baselineFrozen()) {
                continue;
            }
            OptionalLong fromCatalog = catalog.baselineQuantity(session.branchId(), item.itemId());
            out.put(item.itemId(), fromCatalog.isPresent() ? fromCatalog.getAsLong() : 0L);
        }
        return out;
    }

    private List<String> uncountedItems(String sessionId) {
        StockTakeStore.LedgerSnapshot snapshot = store.snapshot(sessionId, 1)
                .orElseThrow(() -> StockTakeException.notFound(sessionId));
        List<String> missing = new ArrayList<>();
        for (AssignedItem item : snapshot.items()) {
            if (!snapshot.latestByItem().containsKey(item.itemId())) {
                missing.add(item.itemId());
            }
        }
        return missing;
    }

    private SessionView requireSession(String sessionId) {
        requireSessionId(sessionId);
        return store.findSession(sessionId).orElseThrow(() -> StockTakeException.notFound(sessionId));
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw StockTakeException.validation("session id must not be blank");
        }
    }

    /** Re-reads the session once its gate is held; a terminal session no longer needs the gate. */
    private SessionView requireSessionInGate(String sessionId) {
        SessionView session = requireSession(sessionId);
        if (session.status().isTerminal()) {
            locks.discardGate(sessionId);
        }
        return session;
    }

    private static StockTakeException invalidTransition(SessionView session, SessionStatus to) {
        return new StockTakeException(ErrorKind.INVALID_TRANSITION,
                "Cannot move session " + session.sessionCode() + " from " + session.status() + " to " + to,
                Map.of("session_id", session.sessionId(), "from", session.status().name(), "to", to.name()));
    }

    private static StockTakeException notEditable(SessionView session) {
        return new StockTakeException(ErrorKind.INVALID_TRANSITION,
                "Session " + session.sessionCode() + " is " + session.status() + " and cannot be edited",
                Map.of("session_id", session.sessionId(), "status", session.status().name()));
    }

    /** {@code ST-MAR25A} .. {@code ST-MAR25Z}, then {@code ST-MAR25A2} and so on. */
    String nextSessionCode(long nowMs) {
        LocalDate day = LocalDate.ofEpochDay(Math.floorDiv(nowMs, 86_400_000L));
        String prefix = "ST-"
                + day.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ROOT)
                + String.format(Locale.ROOT, "%02d", day.getDayOfMonth());
        for (int round = 1; round <= MAX_SUFFIX_ROUNDS; round++) {
            for (char letter = 'A'; letter <= 'Z'; letter++) {
                String candidate = prefix + letter + (round == 1 ? "" : String.valueOf(round));
                if (!store.sessionCodeExists(candidate)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("Session codes exhausted for " + prefix);
    }

    private SettingsReloadOutcome loadSettings() {
        StockTakeSettings previous = settings;
        StockTakeSettings loaded = StockTakeSettings.load(config.settingsFile());
        List<String> changed = previous.diff(loaded);
        settings = loaded;
        boolean exists = Files.exists(config.settingsFile());
        if (!changed.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of("settings.load", "system", "success", null,
                    Map.of("changed_fields", changed)));
            log.info("Stock take settings changed: {}", changed);
        }
        return new SettingsReloadOutcome(
                !changed.isEmpty(),
                exists,
                config.settingsFile().toString(),
                loaded,
                clock.millis(),
                changed
        );
    }

    private static void validateNewSession(NewSession request) {
        if (request == null) {
            throw StockTakeException.validation("session request must not be null");
        }
        requireText(request.branchId(), "branch");
        requireText(request.createdBy(), "creator");
        List<ItemSeed> items = request.items() == null ? List.of() : request.items();
        if (items.isEmpty()) {
            throw StockTakeException.validation("session must list at least one item");
        }
        Set<String> seen = new HashSet<>();
        for (ItemSeed seed : items) {
            if (seed == null || seed.itemId() == null || seed.itemId().isBlank()) {
                throw StockTakeException.validation("item id must not be blank");
            }
            if (!seen.add(seed.itemId().trim())) {
                throw StockTakeException.validation("duplicate item id " + seed.itemId().trim());
            }
            if (seed.baselineQuantity() != null && seed.baselineQuantity() < 0L) {
                throw StockTakeException.validation("baseline quantity must not be negative for " + seed.itemId());
            }
        }
        if (!request.multiUser() && normalizeCounters(request.allowedCounters()).size() > 1) {
            throw StockTakeException.validation("single-user session allows at most one counter");
        }
    }

    private static void validateShelfOwners(List<String> allowed, Map<String, List<String>> shelves) {
        if (allowed.isEmpty()) {
            return;
        }
        for (String counter : shelves.keySet()) {
            if (!allowed.contains(counter)) {
                throw StockTakeException.validation("shelves assigned to " + counter + " who is not an allowed counter");
            }
        }
    }

    private static List<String> normalizeCounters(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String counter : raw) {
            if (counter == null || counter.isBlank()) {
                throw StockTakeException.validation("counter id must not be blank");
            }
            out.add(counter.trim());
        }
        return List.copyOf(out);
    }

    private static Map<String, List<String>> normalizeShelves(Map<String, List<String>> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : raw.entrySet()) {
            String counter = requireText(e.getKey(), "shelf owner");
            List<String> shelves = new ArrayList<>();
            for (String shelf : e.getValue() == null ? List.<String>of() : e.getValue()) {
                if (shelf != null && !shelf.isBlank() && !shelves.contains(shelf.trim())) {
                    shelves.add(shelf.trim());
                }
            }
            out.put(counter, List.copyOf(shelves));
        }
        return out;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw StockTakeException.validation(field + " must not be blank");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record ReleaseOutcome(String sessionId, String itemId, String counterId, boolean released) {
    }

    public record AuditIntegrityOutcome(boolean ok, int rowsVerified, String headHash, String message) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            StockTakeSettings settings,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }
}
