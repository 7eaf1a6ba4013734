package com.hivemind.core.events;

import java.util.Locale;

/**
 * Notifications published by the orchestrator.
 */
public enum EventType {
    TASK_SUBMITTED,
    TASK_ASSIGNED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,
    AGENT_SPAWNED,
    METRICS_UPDATED;

    /** Name used by subscribers that register by string, e.g. "task_completed". */
    public String eventName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromName(String eventName) {
        try {
            return valueOf(eventName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown event: " + eventName, e);
        }
    }
}
