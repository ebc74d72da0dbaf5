package com.questrail.navigation.api;

import java.util.Objects;

/**
 * One entry of a route: the move taken and the position it led to.
 *
 * <p>For the terminal {@link Move#REACHED_GOAL} entry the position is the
 * goal itself.</p>
 */
public record RouteStep(Position position, Move move)
{
    public RouteStep {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(move, "move");
    }

    public boolean isTerminal()
    {
        return move == Move.REACHED_GOAL;
    }
}
