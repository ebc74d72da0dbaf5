package com.questrail.navigation.api;

/**
 * Position
 * -----------------------------------------------------------------------------
 * One grid coordinate as an ordered (row, column) pair.
 *
 * <p>Rows run along the vertical axis and grow downward; columns run along the
 * horizontal axis and grow to the right. Coordinates are not bounded here; the
 * grid decides whether a position lies inside it.</p>
 */
public record Position(int row, int column)
{
    /**
     * Returns the position reached by applying one move to this position.
     * {@link Move#REACHED_GOAL} returns this position unchanged.
     */
    public Position step(Move move)
    {
        return new Position(row + move.rowDelta(), column + move.columnDelta());
    }

    /**
     * Signed row distance from this position to {@code target}.
     */
    public int rowDeltaTo(Position target)
    {
        return target.row - row;
    }

    /**
     * Signed column distance from this position to {@code target}.
     */
    public int columnDeltaTo(Position target)
    {
        return target.column - column;
    }

    public int manhattanDistanceTo(Position target)
    {
        return Math.abs(rowDeltaTo(target)) + Math.abs(columnDeltaTo(target));
    }

    /**
     * True when {@code other} is exactly one unit away on exactly one axis.
     */
    public boolean isAdjacentTo(Position other)
    {
        return manhattanDistanceTo(other) == 1;
    }

    public static Position of(int row, int column)
    {
        return new Position(row, column);
    }

    @Override
    public String toString()
    {
        return "(" + row + "," + column + ")";
    }
}
