package com.questrail.navigation.observability;

import com.questrail.navigation.api.Position;
import com.questrail.navigation.api.RouteStep;

import java.time.Instant;

/**
 * Record representing one route entry appended by the driver.
 *
 * @param stepIndex 1-based index of the entry within the route
 * @param from      position the move was taken from
 * @param step      the appended entry
 */
public record RouteStepEvent(
    Instant timestamp,
    int stepIndex,
    Position from,
    RouteStep step
) {
}
