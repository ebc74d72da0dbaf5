package com.questrail.navigation.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timing and size summary of one planning run.
 *
 * @param startedAt  wall-clock time the run began (observability only)
 * @param finishedAt wall-clock time the run ended (observability only)
 * @param elapsed    elapsed time measured on a monotonic clock
 * @param steps      number of directional moves taken
 */
public record RunSummary(Instant startedAt, Instant finishedAt, Duration elapsed, int steps)
{
    public RunSummary {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        Objects.requireNonNull(elapsed, "elapsed");
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative");
        }
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be non-negative");
        }
    }
}
