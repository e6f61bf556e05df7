package io.stocktake.session;

import io.stocktake.model.SessionView;

/**
 * Decides whether an actor may start a session. Role resolution lives outside the
 * engine; callers plug in their own source.
 */
@FunctionalInterface
public interface StartPermission {
    StartPermission ALLOW_ALL = (actor, session) -> true;

    boolean mayStart(String actor, SessionView session);
}
