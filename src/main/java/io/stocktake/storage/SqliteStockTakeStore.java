package io.stocktake.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.stocktake.model.AssignedItem;
import io.stocktake.model.CountEntry;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionUpdate;
import io.stocktake.model.SessionView;
import io.stocktake.model.ShelfReview;
import io.stocktake.model.ShelfReviewStatus;
import io.stocktake.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SqliteStockTakeStore implements StockTakeStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<String>>> SHELF_MAP = new TypeReference<>() {
    };
    private static final String SESSION_COLUMNS = """
            s.session_id,s.session_code,s.branch_id,s.created_by,s.is_multi_user,s.allowed_counters,
            s.assigned_shelves,s.notes,s.status,s.force_completed,s.created_at_ms,s.updated_at_ms,
            s.started_at_ms,s.paused_at_ms,s.completed_at_ms,s.cancelled_at_ms,
            (SELECT COUNT(1) FROM session_items i WHERE i.session_id=s.session_id) AS item_count
            """;
    private static final String COUNT_COLUMNS = """
            seq,entry_id,session_id,item_id,counter_id,counted_quantity,baseline_quantity,variance,
            shelf_location,notes,counted_at_ms
            """;

    private final Database database;

    public SqliteStockTakeStore(Database database) {
        this.database = database;
    }

    @Override
    public void init() {
        database.init();
    }

    @Override
    public boolean insertSessionIfBranchIdle(SessionView s, List<AssignedItem> items) {
        // The conditional insert is the first statement so the write lock is taken before
        // the open-session check is evaluated.
        String insertSession = """
                INSERT INTO sessions(session_id,session_code,branch_id,created_by,is_multi_user,allowed_counters,
                    assigned_shelves,notes,status,force_completed,created_at_ms,updated_at_ms)
                SELECT ?,?,?,?,?,?,?,?,?,0,?,?
                WHERE NOT EXISTS (
                    SELECT 1 FROM sessions WHERE branch_id=? AND status IN ('DRAFT','ACTIVE','PAUSED')
                )
                """;
        String insertItem = "INSERT INTO session_items(session_id,item_id,baseline_quantity,shelf_location,baseline_frozen_at_ms,created_at_ms) VALUES(?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(insertSession);
                 PreparedStatement pi = c.prepareStatement(insertItem)) {
                ps.setString(1, s.sessionId());
                ps.setString(2, s.sessionCode());
                ps.setString(3, s.branchId());
                ps.setString(4, s.createdBy());
                ps.setInt(5, s.multiUser() ? 1 : 0);
                ps.setString(6, Jsons.toCompactJson(s.allowedCounters()));
                ps.setString(7, Jsons.toCompactJson(s.assignedShelves()));
                ps.setString(8, s.notes());
                ps.setString(9, s.status().name());
                ps.setLong(10, s.createdAtMs());
                ps.setLong(11, s.updatedAtMs());
                ps.setString(12, s.branchId());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                for (AssignedItem item : items) {
                    pi.setString(1, s.sessionId());
                    pi.setString(2, item.itemId());
                    setNullableLong(pi, 3, item.baselineQuantity());
                    pi.setString(4, item.shelfLocation());
                    setNullableLong(pi, 5, item.baselineFrozenAtMs());
                    pi.setLong(6, s.createdAtMs());
                    pi.executeUpdate();
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert session", e);
        }
    }

    @Override
    public boolean sessionCodeExists(String sessionCode) {
        String sql = "SELECT 1 FROM sessions WHERE UPPER(session_code)=UPPER(?) LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionCode);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check session code", e);
        }
    }

    @Override
    public Optional<SessionView> findSession(String sessionId) {
        try (Connection c = database.openConnection()) {
            return readSession(c, sessionId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session", e);
        }
    }

    @Override
    public Optional<SessionView> findSessionByCode(String sessionCode) {
        String sql = "SELECT " + SESSION_COLUMNS + " FROM sessions s WHERE UPPER(s.session_code)=UPPER(?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionCode == null ? "" : sessionCode.trim());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapSession(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session by code", e);
        }
    }

    @Override
    public List<SessionView> listSessions(String branchId, SessionStatus status, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(SESSION_COLUMNS).append(" FROM sessions s WHERE 1=1");
        List<String> args = new ArrayList<>();
        if (branchId != null && !branchId.isBlank()) {
            sql.append(" AND s.branch_id=?");
            args.add(branchId);
        }
        if (status != null) {
            sql.append(" AND s.status=?");
            args.add(status.name());
        }
        sql.append(" ORDER BY s.created_at_ms DESC, s.session_id DESC LIMIT ?");
        List<SessionView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            for (String arg : args) {
                ps.setString(idx++, arg);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapSession(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list sessions", e);
        }
    }

    @Override
    public boolean transition(StatusTransition t) {
        String stampColumn = switch (t.to()) {
            case ACTIVE -> t.from() == SessionStatus.DRAFT ? "started_at_ms" : null;
            case PAUSED -> "paused_at_ms";
            case COMPLETED -> "completed_at_ms";
            case CANCELLED -> "cancelled_at_ms";
            case DRAFT -> null;
        };
        String update = "UPDATE sessions SET status=?,force_completed=?,updated_at_ms=?"
                + (stampColumn == null ? "" : "," + stampColumn + "=?")
                + " WHERE session_id=? AND status=?";
        String freeze = "UPDATE session_items SET baseline_quantity=?,baseline_frozen_at_ms=? WHERE session_id=? AND item_id=? AND baseline_quantity IS NULL";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update);
                 PreparedStatement pf = c.prepareStatement(freeze)) {
                int idx = 1;
                ps.setString(idx++, t.to().name());
                ps.setInt(idx++, t.forceCompleted() ? 1 : 0);
                ps.setLong(idx++, t.nowMs());
                if (stampColumn != null) {
                    ps.setLong(idx++, t.nowMs());
                }
                ps.setString(idx++, t.sessionId());
                ps.setString(idx, t.from().name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                for (Map.Entry<String, Long> e : t.baselines().entrySet()) {
                    pf.setLong(1, e.getValue());
                    pf.setLong(2, t.nowMs());
                    pf.setString(3, t.sessionId());
                    pf.setString(4, e.getKey());
                    pf.executeUpdate();
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed session transition " + t.from() + " -> " + t.to(), e);
        }
    }

    @Override
    public boolean updateSessionDetails(String sessionId, SessionUpdate update, long nowMs) {
        String sql = """
                UPDATE sessions SET
                    allowed_counters=COALESCE(?,allowed_counters),
                    assigned_shelves=COALESCE(?,assigned_shelves),
                    notes=COALESCE(?,notes),
                    updated_at_ms=?
                WHERE session_id=? AND status IN ('DRAFT','ACTIVE','PAUSED')
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, update.allowedCounters() == null ? null : Jsons.toCompactJson(update.allowedCounters()));
            ps.setString(2, update.assignedShelves() == null ? null : Jsons.toCompactJson(update.assignedShelves()));
            ps.setString(3, update.notes());
            ps.setLong(4, nowMs);
            ps.setString(5, sessionId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update session", e);
        }
    }

    @Override
    public List<AssignedItem> listItems(String sessionId) {
        try (Connection c = database.openConnection()) {
            return readItems(c, sessionId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list session items", e);
        }
    }

    @Override
    public Optional<AssignedItem> findItem(String sessionId, String itemId) {
        String sql = "SELECT session_id,item_id,baseline_quantity,shelf_location,baseline_frozen_at_ms FROM session_items WHERE session_id=? AND item_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setString(2, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapItem(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session item", e);
        }
    }

    @Override
    public CountEntry appendCount(CountEntry e) {
        String sql = "INSERT INTO count_entries(entry_id,session_id,item_id,counter_id,counted_quantity,baseline_quantity,variance,shelf_location,notes,counted_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             PreparedStatement seq = c.prepareStatement("SELECT seq FROM count_entries WHERE entry_id=?")) {
            ps.setString(1, e.entryId());
            ps.setString(2, e.sessionId());
            ps.setString(3, e.itemId());
            ps.setString(4, e.counterId());
            ps.setLong(5, e.countedQuantity());
            ps.setLong(6, e.baselineQuantity());
            ps.setLong(7, e.variance());
            ps.setString(8, e.shelfLocation());
            ps.setString(9, e.notes());
            ps.setLong(10, e.countedAtMs());
            ps.executeUpdate();
            seq.setString(1, e.entryId());
            try (ResultSet rs = seq.executeQuery()) {
                long assigned = rs.next() ? rs.getLong(1) : 0L;
                return new CountEntry(e.entryId(), e.sessionId(), e.itemId(), e.counterId(), e.countedQuantity(),
                        e.baselineQuantity(), e.variance(), e.shelfLocation(), e.notes(), e.countedAtMs(), assigned);
            }
        } catch (SQLException ex) {
            throw new RuntimeException("Failed to append count entry", ex);
        }
    }

    @Override
    public List<CountEntry> listCounts(String sessionId, String counterId, int limit) {
        boolean byCounter = counterId != null && !counterId.isBlank();
        String sql = "SELECT " + COUNT_COLUMNS + " FROM count_entries WHERE session_id=?"
                + (byCounter ? " AND counter_id=?" : "")
                + " ORDER BY counted_at_ms DESC, seq DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, sessionId);
            if (byCounter) {
                ps.setString(idx++, counterId);
            }
            ps.setInt(idx, Math.max(1, limit));
            return readCounts(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list counts", e);
        }
    }

    @Override
    public Optional<LedgerSnapshot> snapshot(String sessionId, int recentLimit) {
        String allCounts = "SELECT " + COUNT_COLUMNS + " FROM count_entries WHERE session_id=? ORDER BY seq ASC";
        String recent = "SELECT " + COUNT_COLUMNS + " FROM count_entries WHERE session_id=? ORDER BY counted_at_ms DESC, seq DESC LIMIT ?";
        try (Connection c = database.openConnection()) {
            // One read transaction: WAL gives every statement below the same snapshot.
            c.setAutoCommit(false);
            try (PreparedStatement psAll = c.prepareStatement(allCounts);
                 PreparedStatement psRecent = c.prepareStatement(recent)) {
                Optional<SessionView> session = readSession(c, sessionId);
                if (session.isEmpty()) {
                    c.commit();
                    return Optional.empty();
                }
                List<AssignedItem> items = readItems(c, sessionId);
                psAll.setString(1, sessionId);
                Map<String, CountEntry> latest = new LinkedHashMap<>();
                Map<String, Integer> entryCounts = new HashMap<>();
                for (CountEntry e : readCounts(psAll)) {
                    latest.put(e.itemId(), e);
                    entryCounts.merge(e.itemId(), 1, Integer::sum);
                }
                psRecent.setString(1, sessionId);
                psRecent.setInt(2, Math.max(1, recentLimit));
                List<CountEntry> recentCounts = readCounts(psRecent);
                c.commit();
                return Optional.of(new LedgerSnapshot(session.get(), items, latest, entryCounts, recentCounts));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read ledger snapshot", e);
        }
    }

    @Override
    public ShelfReview appendShelfReview(ShelfReview r) {
        String sql = "INSERT INTO shelf_reviews(review_id,session_id,shelf_location,status,reviewed_by,rejection_reason,reviewed_at_ms) VALUES(?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             PreparedStatement seq = c.prepareStatement("SELECT seq FROM shelf_reviews WHERE review_id=?")) {
            ps.setString(1, r.reviewId());
            ps.setString(2, r.sessionId());
            ps.setString(3, r.shelfLocation());
            ps.setString(4, r.status().name());
            ps.setString(5, r.reviewedBy());
            ps.setString(6, r.rejectionReason());
            ps.setLong(7, r.reviewedAtMs());
            ps.executeUpdate();
            seq.setString(1, r.reviewId());
            try (ResultSet rs = seq.executeQuery()) {
                long assigned = rs.next() ? rs.getLong(1) : 0L;
                return new ShelfReview(r.reviewId(), r.sessionId(), r.shelfLocation(), r.status(),
                        r.reviewedBy(), r.rejectionReason(), r.reviewedAtMs(), assigned);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append shelf review", e);
        }
    }

    @Override
    public ShelfLedger shelfLedger(String sessionId) {
        String shelved = "SELECT " + COUNT_COLUMNS + " FROM count_entries WHERE session_id=? AND shelf_location IS NOT NULL ORDER BY seq ASC";
        String reviews = "SELECT seq,review_id,session_id,shelf_location,status,reviewed_by,rejection_reason,reviewed_at_ms FROM shelf_reviews WHERE session_id=? ORDER BY seq ASC";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psCounts = c.prepareStatement(shelved);
                 PreparedStatement psReviews = c.prepareStatement(reviews)) {
                psCounts.setString(1, sessionId);
                List<CountEntry> entries = readCounts(psCounts);
                psReviews.setString(1, sessionId);
                List<ShelfReview> out = new ArrayList<>();
                try (ResultSet rs = psReviews.executeQuery()) {
                    while (rs.next()) {
                        out.add(new ShelfReview(
                                rs.getString("review_id"),
                                rs.getString("session_id"),
                                rs.getString("shelf_location"),
                                ShelfReviewStatus.fromString(rs.getString("status")),
                                rs.getString("reviewed_by"),
                                rs.getString("rejection_reason"),
                                rs.getLong("reviewed_at_ms"),
                                rs.getLong("seq")
                        ));
                    }
                }
                c.commit();
                return new ShelfLedger(entries, out);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read shelf ledger", e);
        }
    }

    private Optional<SessionView> readSession(Connection c, String sessionId) throws SQLException {
        String sql = "SELECT " + SESSION_COLUMNS + " FROM sessions s WHERE s.session_id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapSession(rs));
            }
        }
    }

    private List<AssignedItem> readItems(Connection c, String sessionId) throws SQLException {
        String sql = "SELECT session_id,item_id,baseline_quantity,shelf_location,baseline_frozen_at_ms FROM session_items WHERE session_id=? ORDER BY item_id";
        List<AssignedItem> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapItem(rs));
                }
            }
        }
        return out;
    }

    private List<CountEntry> readCounts(PreparedStatement ps) throws SQLException {
        List<CountEntry> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new CountEntry(
                        rs.getString("entry_id"),
                        rs.getString("session_id"),
                        rs.getString("item_id"),
                        rs.getString("counter_id"),
                        rs.getLong("counted_quantity"),
                        rs.getLong("baseline_quantity"),
                        rs.getLong("variance"),
                        rs.getString("shelf_location"),
                        rs.getString("notes"),
                        rs.getLong("counted_at_ms"),
                        rs.getLong("seq")
                ));
            }
        }
        return out;
    }

    private SessionView mapSession(ResultSet rs) throws SQLException {
        return new SessionView(
                rs.getString("session_id"),
                rs.getString("session_code"),
                rs.getString("branch_id"),
                rs.getString("created_by"),
                rs.getInt("is_multi_user") == 1,
                parseJson(rs.getString("allowed_counters"), STRING_LIST, List.of()),
                parseJson(rs.getString("assigned_shelves"), SHELF_MAP, Map.of()),
                rs.getString("notes"),
                SessionStatus.fromString(rs.getString("status")),
                rs.getInt("force_completed") == 1,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "paused_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                nullableLong(rs, "cancelled_at_ms"),
                rs.getInt("item_count")
        );
    }

    private AssignedItem mapItem(ResultSet rs) throws SQLException {
        return new AssignedItem(
                rs.getString("session_id"),
                rs.getString("item_id"),
                nullableLong(rs, "baseline_quantity"),
                rs.getString("shelf_location"),
                nullableLong(rs, "baseline_frozen_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.INTEGER);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static <T> T parseJson(String raw, TypeReference<T> type, T fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Jsons.mapper().readValue(raw, type);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt JSON column value: " + raw, e);
        }
    }
}
