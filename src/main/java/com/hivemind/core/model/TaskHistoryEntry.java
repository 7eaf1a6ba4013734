package com.hivemind.core.model;

/**
 * One settled task in an agent's learning log.
 */
public record TaskHistoryEntry(String taskType, long durationMs, boolean success) {
}
