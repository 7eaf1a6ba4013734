package com.hivemind.core.execution;

/**
 * Outcome reported by a {@link TaskDispatcher}.
 *
 * @param success    whether the work succeeded
 * @param durationMs how long the work took
 * @param detail     failure reason, or null on success
 */
public record DispatchResult(boolean success, long durationMs, String detail) {

    public static DispatchResult success(long durationMs) {
        return new DispatchResult(true, durationMs, null);
    }

    public static DispatchResult failure(long durationMs, String detail) {
        return new DispatchResult(false, durationMs, detail);
    }
}
