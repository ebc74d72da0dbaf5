package com.questrail.navigation.observability;

import com.questrail.navigation.api.Move;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing one completed command/acknowledgement exchange with the
 * external controller.
 *
 * @param acknowledgement acknowledgement text as received, for display
 * @param waited          time spent blocked on the acknowledgement
 */
public record StepExchangeEvent(
    Instant timestamp,
    Move move,
    String acknowledgement,
    Duration waited
) {
}
