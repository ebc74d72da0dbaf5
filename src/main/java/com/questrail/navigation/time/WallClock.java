package com.questrail.navigation.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for run summaries and observability timestamps.
 *
 * <p>This clock may jump (NTP, DST, manual changes). It MUST NOT be used to
 * measure durations or to bound waits.</p>
 */
public interface WallClock
{
    Instant now();
}
