package com.marketobserver.model;

/**
 * Observation note raised by a ratio rule. Carries no direction and no advice.
 */
public record Trigger(
        String id,
        String name,
        String message,
        boolean fired
) {
}
