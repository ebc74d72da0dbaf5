package com.questrail.navigation.api;

import java.util.Optional;

/**
 * CellStatus
 * -----------------------------------------------------------------------------
 * Mutually exclusive status tag of one grid cell.
 *
 * <p>The numeric codes are the ones used by tabular map files.</p>
 *
 * <h2>Transitions</h2>
 * Only {@link #FREE} ever changes, and only to {@link #VISITED}, exactly once,
 * when the route passes through it. {@link #START}, {@link #GOAL} and
 * {@link #OCCUPIED} never become visited.
 */
public enum CellStatus
{
    FREE(0),
    OCCUPIED(1),
    VISITED(2),
    START(3),
    GOAL(4);

    private final int code;

    CellStatus(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    /**
     * Statuses a route may step onto, before visitation history is applied.
     */
    public boolean isTraversable()
    {
        return this == FREE || this == START || this == GOAL;
    }

    public static Optional<CellStatus> fromCode(int code)
    {
        for (CellStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
