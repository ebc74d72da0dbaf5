package com.questrail.navigation.observability;

import java.time.Instant;

/**
 * Record representing a failure that ended, or threatened, a planning run.
 */
public record NavigationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
