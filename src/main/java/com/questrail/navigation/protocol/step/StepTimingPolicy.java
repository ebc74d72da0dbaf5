package com.questrail.navigation.protocol.step;

import java.time.Duration;
import java.util.Objects;

/**
 * StepTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the controller channel.
 *
 * <p>This is deliberately <em>operational only</em>. It bounds how long the
 * adapter waits; it never changes what is sent or how a decision is made.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>acknowledgementTimeout</b>: Maximum time to block for one
 *       acknowledgement. {@link Duration#ZERO} means wait indefinitely.</li>
 *   <li><b>transportStartTimeout</b>: Maximum time to wait for both channel
 *       endpoints to come up when the adapter starts.</li>
 * </ul>
 */
public record StepTimingPolicy(
        Duration acknowledgementTimeout,
        Duration transportStartTimeout
) {
    /**
     * Canonical constructor with validation.
     */
    public StepTimingPolicy {
        Objects.requireNonNull(acknowledgementTimeout, "acknowledgementTimeout");
        Objects.requireNonNull(transportStartTimeout, "transportStartTimeout");

        if (acknowledgementTimeout.isNegative()) {
            throw new IllegalArgumentException("acknowledgementTimeout must be non-negative");
        }
        if (transportStartTimeout.isNegative() || transportStartTimeout.isZero()) {
            throw new IllegalArgumentException("transportStartTimeout must be positive");
        }
    }

    /**
     * Whether acknowledgement waits are bounded.
     */
    public boolean isAcknowledgementBounded() {
        return !acknowledgementTimeout.isZero();
    }

    /**
     * Returns a copy with a different acknowledgement timeout.
     */
    public StepTimingPolicy withAcknowledgementTimeout(Duration timeout) {
        return new StepTimingPolicy(timeout, transportStartTimeout);
    }

    /**
     * Default values:
     * <ul>
     *   <li>acknowledgementTimeout: unbounded</li>
     *   <li>transportStartTimeout: 5s</li>
     * </ul>
     */
    public static StepTimingPolicy defaults() {
        return new StepTimingPolicy(Duration.ZERO, Duration.ofSeconds(5));
    }
}
