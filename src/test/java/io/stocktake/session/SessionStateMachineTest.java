package io.stocktake.session;

import io.stocktake.error.ErrorKind;
import io.stocktake.error.StockTakeException;
import io.stocktake.model.SessionStatus;
import io.stocktake.model.SessionView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SessionStateMachineTest {

    @Test
    void allowedEdgesMatchTheLifecycle() {
        Assertions.assertTrue(SessionStateMachine.canTransition(SessionStatus.DRAFT, SessionStatus.ACTIVE));
        Assertions.assertTrue(SessionStateMachine.canTransition(SessionStatus.DRAFT, SessionStatus.CANCELLED));
        Assertions.assertFalse(SessionStateMachine.canTransition(SessionStatus.DRAFT, SessionStatus.PAUSED));
        Assertions.assertFalse(SessionStateMachine.canTransition(SessionStatus.DRAFT, SessionStatus.COMPLETED));
        Assertions.assertTrue(SessionStateMachine.canTransition(SessionStatus.ACTIVE, SessionStatus.PAUSED));
        Assertions.assertTrue(SessionStateMachine.canTransition(SessionStatus.PAUSED, SessionStatus.ACTIVE));
        Assertions.assertTrue(SessionStateMachine.canTransition(SessionStatus.PAUSED, SessionStatus.COMPLETED));
        for (SessionStatus to : SessionStatus.values()) {
            Assertions.assertFalse(SessionStateMachine.canTransition(SessionStatus.COMPLETED, to));
            Assertions.assertFalse(SessionStateMachine.canTransition(SessionStatus.CANCELLED, to));
        }
    }

    @Test
    void rejectionsCarryTheirKind() {
        SessionView completed = session(SessionStatus.COMPLETED);
        StockTakeException invalid = Assertions.assertThrows(StockTakeException.class,
                () -> SessionStateMachine.requireTransition(completed, SessionStatus.ACTIVE));
        Assertions.assertEquals(ErrorKind.INVALID_TRANSITION, invalid.kind());

        StockTakeException notActive = Assertions.assertThrows(StockTakeException.class,
                () -> SessionStateMachine.requireActive(session(SessionStatus.PAUSED)));
        Assertions.assertEquals(ErrorKind.SESSION_NOT_ACTIVE, notActive.kind());
        SessionStateMachine.requireActive(session(SessionStatus.ACTIVE));
    }

    @Test
    void onlyLeavingActiveWorkReleasesLocks() {
        Assertions.assertTrue(SessionStateMachine.releasesLocks(SessionStatus.PAUSED));
        Assertions.assertTrue(SessionStateMachine.releasesLocks(SessionStatus.COMPLETED));
        Assertions.assertTrue(SessionStateMachine.releasesLocks(SessionStatus.CANCELLED));
        Assertions.assertFalse(SessionStateMachine.releasesLocks(SessionStatus.ACTIVE));
    }

    private static SessionView session(SessionStatus status) {
        return new SessionView("s1", "ST-JAN01A", "br", "mgr", true, List.of(), Map.of(), null,
                status, false, 0L, 0L, null, null, null, null, 0);
    }
}
