package com.questrail.navigation.observability;

import com.questrail.navigation.api.Position;
import com.questrail.navigation.driver.DriverState;

import java.time.Instant;

/**
 * Record representing a state transition of the route driver.
 *
 * @param position route position at the time of the transition
 * @param steps    directional moves taken so far
 */
public record DriverStateTransitionEvent(
    Instant timestamp,
    DriverState oldState,
    DriverState newState,
    Position position,
    int steps
) {
    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
