package com.questrail.navigation.api;

import java.util.Optional;

/**
 * Move
 * -----------------------------------------------------------------------------
 * One planner decision and the command token that carries it to an external
 * controller.
 *
 * <h2>Wire tokens</h2>
 * The token spelling is part of the step protocol and must not change:
 * <ul>
 *   <li>{@link #UP} → {@code UP}</li>
 *   <li>{@link #DOWN} → {@code DOWN}</li>
 *   <li>{@link #LEFT} → {@code LEFT}</li>
 *   <li>{@link #RIGHT} → {@code RIGHT}</li>
 *   <li>{@link #REACHED_GOAL} → {@code GOAL}</li>
 * </ul>
 *
 * <p>{@code UP}/{@code DOWN} change the row, {@code LEFT}/{@code RIGHT} change
 * the column. {@code REACHED_GOAL} is terminal and does not move.</p>
 */
public enum Move
{
    UP(-1, 0, "UP"),
    DOWN(1, 0, "DOWN"),
    LEFT(0, -1, "LEFT"),
    RIGHT(0, 1, "RIGHT"),
    REACHED_GOAL(0, 0, "GOAL");

    private final int rowDelta;
    private final int columnDelta;
    private final String token;

    Move(int rowDelta, int columnDelta, String token)
    {
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
        this.token = token;
    }

    public int rowDelta()
    {
        return rowDelta;
    }

    public int columnDelta()
    {
        return columnDelta;
    }

    /**
     * Returns the command token sent to the external controller.
     */
    public String token()
    {
        return token;
    }

    public boolean isDirectional()
    {
        return this != REACHED_GOAL;
    }

    /**
     * Returns the move in the opposite direction. {@link #REACHED_GOAL} is its
     * own reverse.
     */
    public Move reverse()
    {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case REACHED_GOAL -> REACHED_GOAL;
        };
    }

    /**
     * Resolves a wire token back into a move. Matching is exact.
     */
    public static Optional<Move> fromToken(String token)
    {
        for (Move move : values()) {
            if (move.token.equals(token)) {
                return Optional.of(move);
            }
        }
        return Optional.empty();
    }
}
