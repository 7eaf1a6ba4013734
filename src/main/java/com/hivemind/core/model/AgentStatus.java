package com.hivemind.core.model;

import java.util.Locale;

/**
 * Availability of an agent. IDLE, BUSY and OVERLOADED are derived from load;
 * OFFLINE and MAINTENANCE are set administratively and stick until cleared.
 */
public enum AgentStatus {
    IDLE,
    BUSY,
    OVERLOADED,
    OFFLINE,
    MAINTENANCE;

    public boolean isAdministrative() {
        return this == OFFLINE || this == MAINTENANCE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
