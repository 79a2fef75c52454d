package com.gocars.ridesafety.service;

import com.gocars.ridesafety.model.MonitoringSession;

/**
 * Called by {@link SessionContext} after each committed update, with the session lock still held.
 */
@FunctionalInterface
public interface SessionUpdateListener {

    void onSessionUpdated(MonitoringSession session);
}
