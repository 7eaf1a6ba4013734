package com.hivemind.core.model;

import java.time.Instant;

/**
 * Record of a capability level change applied by the learning controller.
 *
 * @param capability the capability whose level moved
 * @param delta      signed change that was requested (positive on success)
 * @param newLevel   level after clamping
 * @param timestamp  when the change was applied
 */
public record Adaptation(CapabilityType capability, double delta, double newLevel, Instant timestamp) {
}
