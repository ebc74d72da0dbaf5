package com.questrail.navigation.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RouteResult
 * -----------------------------------------------------------------------------
 * Immutable outcome of one planning run, handed to the caller when the run
 * ends, successfully or not.
 *
 * <h2>Route contents</h2>
 * The route lists (position, move) pairs from the start (exclusive) onward.
 * A completed route ends with exactly one {@link Move#REACHED_GOAL} entry at
 * the goal. A failed run carries the partial route up to the failure point.
 *
 * <h2>Failure</h2>
 * {@link #failure()} is empty exactly when {@link #status()} is
 * {@link RouteStatus#COMPLETED}.
 */
public final class RouteResult
{
    private final RouteStatus status;
    private final Position start;
    private final Position goal;
    private final List<RouteStep> steps;
    private final Position finalPosition;
    private final NavigationException failure;
    private final RunSummary summary;

    private RouteResult(RouteStatus status,
                        Position start,
                        Position goal,
                        List<RouteStep> steps,
                        Position finalPosition,
                        NavigationException failure,
                        RunSummary summary)
    {
        this.status = Objects.requireNonNull(status, "status");
        this.start = Objects.requireNonNull(start, "start");
        this.goal = Objects.requireNonNull(goal, "goal");
        this.steps = List.copyOf(steps);
        this.finalPosition = Objects.requireNonNull(finalPosition, "finalPosition");
        this.failure = failure;
        this.summary = Objects.requireNonNull(summary, "summary");

        if (status.isSuccess() != (failure == null)) {
            throw new IllegalArgumentException("failure must be present exactly when status is not COMPLETED");
        }
    }

    public static RouteResult completed(Position start,
                                        Position goal,
                                        List<RouteStep> steps,
                                        RunSummary summary)
    {
        return new RouteResult(RouteStatus.COMPLETED, start, goal, steps, goal, null, summary);
    }

    public static RouteResult failed(RouteStatus status,
                                     Position start,
                                     Position goal,
                                     List<RouteStep> steps,
                                     Position finalPosition,
                                     NavigationException failure,
                                     RunSummary summary)
    {
        Objects.requireNonNull(failure, "failure");
        return new RouteResult(status, start, goal, steps, finalPosition, failure, summary);
    }

    public RouteStatus status()
    {
        return status;
    }

    public boolean isCompleted()
    {
        return status.isSuccess();
    }

    public Position start()
    {
        return start;
    }

    public Position goal()
    {
        return goal;
    }

    /**
     * Route entries in the order they were taken.
     */
    public List<RouteStep> steps()
    {
        return steps;
    }

    /**
     * Positions visited after the start, in order, including the goal when
     * completed.
     */
    public List<Position> positions()
    {
        return steps.stream()
                .filter(step -> step.move().isDirectional())
                .map(RouteStep::position)
                .toList();
    }

    /**
     * Position the route stopped at: the goal when completed, otherwise the
     * last position reached before the failure.
     */
    public Position finalPosition()
    {
        return finalPosition;
    }

    public Optional<NavigationException> failure()
    {
        return Optional.ofNullable(failure);
    }

    public RunSummary summary()
    {
        return summary;
    }

    @Override
    public String toString()
    {
        return "RouteResult{status=" + status
                + ", start=" + start
                + ", goal=" + goal
                + ", steps=" + summary.steps()
                + ", finalPosition=" + finalPosition
                + (failure != null ? ", failure=" + failure.getMessage() : "")
                + "}";
    }
}
