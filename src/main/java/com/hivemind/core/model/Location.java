package com.hivemind.core.model;

/**
 * Opaque 2D coordinate of an agent, used only by topology displays.
 */
public record Location(double x, double y) {
}
