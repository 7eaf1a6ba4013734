package com.hivemind.core.model;

import java.util.Locale;

/**
 * Lifecycle of a task: PENDING -> ASSIGNED -> PROCESSING -> COMPLETED | FAILED.
 * A failed critical task may return to PENDING while it has retries left.
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
