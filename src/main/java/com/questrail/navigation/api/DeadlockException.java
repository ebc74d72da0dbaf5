package com.questrail.navigation.api;

import java.util.Objects;

/**
 * Raised when none of the four candidate moves from the current position is
 * traversable. The planner cannot proceed without revisiting a cell or
 * leaving the grid.
 */
public final class DeadlockException extends NavigationException
{
    private final Position stalledAt;
    private final Position goal;

    public DeadlockException(Position stalledAt, Position goal)
    {
        super("No traversable move from " + Objects.requireNonNull(stalledAt, "stalledAt")
                + " towards goal " + Objects.requireNonNull(goal, "goal"));
        this.stalledAt = stalledAt;
        this.goal = goal;
    }

    public Position stalledAt()
    {
        return stalledAt;
    }

    public Position goal()
    {
        return goal;
    }
}
