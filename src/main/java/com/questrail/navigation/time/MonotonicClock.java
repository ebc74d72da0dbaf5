package com.questrail.navigation.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time measurement and acknowledgement deadlines.
 *
 * <h2>Binding invariant</h2>
 * Run durations and wait bounds MUST be computed from a monotonic source.
 * Wall-clock time (see {@link WallClock}) is for observability only.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
