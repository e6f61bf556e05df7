package io.stocktake.session;

import io.stocktake.error.ErrorKind;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionView;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle rules for a stock take session. Terminal states have no outgoing edges.
 */
public final class SessionStateMachine {
    private static final Map<SessionStatus, Set<SessionStatus>> ALLOWED = new EnumMap<>(SessionStatus.class);

    static {
        ALLOWED.put(SessionStatus.DRAFT, EnumSet.of(SessionStatus.ACTIVE, SessionStatus.CANCELLED));
        ALLOWED.put(SessionStatus.ACTIVE, EnumSet.of(
                SessionStatus.PAUSED, SessionStatus.COMPLETED, SessionStatus.CANCELLED));
        ALLOWED.put(SessionStatus.PAUSED, EnumSet.of(
                SessionStatus.ACTIVE, SessionStatus.COMPLETED, SessionStatus.CANCELLED));
        ALLOWED.put(SessionStatus.COMPLETED, EnumSet.noneOf(SessionStatus.class));
        ALLOWED.put(SessionStatus.CANCELLED, EnumSet.noneOf(SessionStatus.class));
    }

    private SessionStateMachine() {
    }

    public static boolean canTransition(SessionStatus from, SessionStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public static void requireTransition(SessionView session, SessionStatus to) {
        if (!canTransition(session.status(), to)) {
            throw new StockTakeException(ErrorKind.INVALID_TRANSITION,
                    "Cannot move session " + session.sessionCode() + " from " + session.status() + " to " + to,
                    Map.of("session_id", session.sessionId(), "from", session.status().name(), "to", to.name()));
        }
    }

    /** Only ACTIVE sessions accept lock acquisition, count submission and joins. */
    public static void requireActive(SessionView session) {
        if (session.status() != SessionStatus.ACTIVE) {
            throw new StockTakeException(ErrorKind.SESSION_NOT_ACTIVE,
                    "Session " + session.sessionCode() + " is " + session.status(),
                    Map.of("session_id", session.sessionId(), "status", session.status().name()));
        }
    }

    /** Every transition except resume and start drops outstanding locks. */
    public static boolean releasesLocks(SessionStatus to) {
        return to == SessionStatus.PAUSED || to == SessionStatus.COMPLETED || to == SessionStatus.CANCELLED;
    }
}
