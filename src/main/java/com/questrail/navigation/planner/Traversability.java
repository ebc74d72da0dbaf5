package com.questrail.navigation.planner;

import com.questrail.navigation.api.Position;

/**
 * Read-only view the planner consults to decide whether it may step onto a
 * position.
 *
 * <p>The driver backs this with the grid and the route's visited set. The
 * planner never mutates either.</p>
 */
@FunctionalInterface
public interface Traversability
{
    /**
     * @return {@code true} if the position is inside the grid, not occupied and
     *         not yet visited by the current route
     */
    boolean isTraversable(Position position);
}
