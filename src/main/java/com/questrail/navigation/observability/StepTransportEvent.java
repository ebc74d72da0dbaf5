package com.questrail.navigation.observability;

import java.time.Instant;

/**
 * Record representing a lifecycle change of one controller channel endpoint.
 *
 * @param endpoint human-readable endpoint role, e.g. {@code "command"}
 * @param up       {@code true} when the endpoint became usable
 * @param cause    diagnostic cause of a down transition; may be {@code null}
 */
public record StepTransportEvent(
    Instant timestamp,
    String endpoint,
    boolean up,
    Throwable cause
) {
}
