package com.questrail.navigation.api;

import java.util.Objects;

/**
 * Raised on an attempt to mark a cell visited that cannot become visited
 * (occupied, or already visited). Correct driving logic never does this, so
 * seeing it means a broken invariant, not bad input.
 */
public final class InvalidTransitionException extends NavigationException
{
    private final Position position;
    private final CellStatus status;

    public InvalidTransitionException(Position position, CellStatus status)
    {
        super("Cannot mark " + Objects.requireNonNull(position, "position")
                + " visited: cell is " + Objects.requireNonNull(status, "status"));
        this.position = position;
        this.status = status;
    }

    public Position position()
    {
        return position;
    }

    public CellStatus status()
    {
        return status;
    }
}
