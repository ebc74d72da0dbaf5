package com.questrail.navigation.planner;

import com.questrail.navigation.api.DeadlockException;
import com.questrail.navigation.api.Move;
import com.questrail.navigation.api.Position;

import java.util.Objects;

/**
 * HeuristicPlanner
 * -----------------------------------------------------------------------------
 * Decides the next move of a route using a directional greedy rule.
 *
 * <h2>Decision</h2>
 * <ol>
 *   <li>At the goal, return {@link Move#REACHED_GOAL}.</li>
 *   <li>Otherwise evaluate {@link CandidateMoves#ordered} in order and return
 *       the first candidate whose resulting position is traversable.</li>
 *   <li>If none is, throw {@link DeadlockException}.</li>
 * </ol>
 *
 * <h2>Statelessness</h2>
 * The planner remembers nothing between calls. All history reaches it through
 * the {@link Traversability} view supplied per decision, which it never
 * mutates. The same inputs always yield the same decision.
 *
 * <p>This is a heuristic, not a shortest-path search. It does not backtrack,
 * so maps solvable only by passing back through an already crossed cell end
 * in a deadlock.</p>
 */
public final class HeuristicPlanner
{
    private final FallbackOrder fallbackOrder;

    public HeuristicPlanner()
    {
        this(FallbackOrder.REVERSE_SECONDARY_FIRST);
    }

    public HeuristicPlanner(FallbackOrder fallbackOrder)
    {
        this.fallbackOrder = Objects.requireNonNull(fallbackOrder, "fallbackOrder");
    }

    public FallbackOrder fallbackOrder()
    {
        return fallbackOrder;
    }

    /**
     * @param current       position the route is at
     * @param goal          goal position
     * @param traversability read-only view of grid and visited set
     * @return the next move; {@link Move#REACHED_GOAL} when {@code current} is the goal
     * @throws DeadlockException if no candidate is traversable
     */
    public Move nextMove(Position current, Position goal, Traversability traversability)
    {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(traversability, "traversability");

        if (current.equals(goal)) {
            return Move.REACHED_GOAL;
        }

        for (Move candidate : CandidateMoves.ordered(current, goal, fallbackOrder)) {
            if (traversability.isTraversable(current.step(candidate))) {
                return candidate;
            }
        }

        throw new DeadlockException(current, goal);
    }
}
