package com.questrail.navigation.planner;

import com.questrail.navigation.api.Move;
import com.questrail.navigation.api.Position;

import java.util.List;
import java.util.Objects;

/**
 * CandidateMoves
 * -----------------------------------------------------------------------------
 * Pure axis-priority rule: turns the remaining distance to the goal into the
 * ordered list of four directional candidates.
 *
 * <h2>Rule</h2>
 * <ul>
 *   <li>The primary axis is the one with the larger absolute delta; ties go to
 *       the row (vertical) axis.</li>
 *   <li>Each axis heads in the sign of its delta. A zero delta heads in the
 *       positive direction ({@link Move#DOWN} / {@link Move#RIGHT}); such a
 *       candidate only matters as a fallback.</li>
 *   <li>Forward candidates come first (primary, then secondary), followed by
 *       the two reversals in the configured {@link FallbackOrder}.</li>
 * </ul>
 *
 * <p>No grid or I/O is involved, so the rule can be checked in isolation.</p>
 */
public final class CandidateMoves
{
    private CandidateMoves() {}

    /**
     * Axis carrying the larger remaining distance.
     */
    public enum Axis { ROW, COLUMN }

    public static Axis primaryAxis(int rowDelta, int columnDelta)
    {
        return Math.abs(rowDelta) >= Math.abs(columnDelta) ? Axis.ROW : Axis.COLUMN;
    }

    public static Move rowMove(int rowDelta)
    {
        return rowDelta < 0 ? Move.UP : Move.DOWN;
    }

    public static Move columnMove(int columnDelta)
    {
        return columnDelta < 0 ? Move.LEFT : Move.RIGHT;
    }

    /**
     * Ordered candidates for moving from {@code current} towards {@code goal}.
     *
     * @return four distinct directional moves, highest priority first
     */
    public static List<Move> ordered(Position current, Position goal, FallbackOrder fallbackOrder)
    {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(goal, "goal");
        return ordered(current.rowDeltaTo(goal), current.columnDeltaTo(goal), fallbackOrder);
    }

    public static List<Move> ordered(int rowDelta, int columnDelta, FallbackOrder fallbackOrder)
    {
        Objects.requireNonNull(fallbackOrder, "fallbackOrder");

        Move vertical = rowMove(rowDelta);
        Move horizontal = columnMove(columnDelta);

        Move primary;
        Move secondary;
        if (primaryAxis(rowDelta, columnDelta) == Axis.ROW) {
            primary = vertical;
            secondary = horizontal;
        }
        else {
            primary = horizontal;
            secondary = vertical;
        }

        return switch (fallbackOrder) {
            case REVERSE_SECONDARY_FIRST -> List.of(primary, secondary, secondary.reverse(), primary.reverse());
            case REVERSE_PRIMARY_FIRST -> List.of(primary, secondary, primary.reverse(), secondary.reverse());
        };
    }
}
