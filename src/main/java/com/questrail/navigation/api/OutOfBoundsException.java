package com.questrail.navigation.api;

import java.util.Objects;

/**
 * Raised when a coordinate lies outside the grid, either while assigning
 * start/goal at load time or on an explicit cell lookup.
 */
public final class OutOfBoundsException extends NavigationException
{
    private final Position position;

    public OutOfBoundsException(Position position, int rows, int columns)
    {
        super("Position " + Objects.requireNonNull(position, "position")
                + " is outside the " + rows + "x" + columns + " grid");
        this.position = position;
    }

    public Position position()
    {
        return position;
    }
}
