package com.hivemind.core.model;

import java.util.Locale;

/**
 * Submitter-declared urgency of a task. Only CRITICAL changes behavior:
 * a failed critical task is requeued at the front of the queue.
 */
public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskPriority fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
