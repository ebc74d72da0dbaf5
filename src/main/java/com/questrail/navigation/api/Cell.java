package com.questrail.navigation.api;

import java.util.Objects;

/**
 * Snapshot of one grid location and its status at the time it was read.
 */
public record Cell(Position position, CellStatus status)
{
    public Cell {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(status, "status");
    }

    public int row()
    {
        return position.row();
    }

    public int column()
    {
        return position.column();
    }
}
