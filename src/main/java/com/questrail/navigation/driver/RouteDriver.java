package com.questrail.navigation.driver;

import com.questrail.navigation.api.CellStatus;
import com.questrail.navigation.api.ControllerException;
import com.questrail.navigation.api.DeadlockException;
import com.questrail.navigation.api.Move;
import com.questrail.navigation.api.NavigationException;
import com.questrail.navigation.api.OutOfBoundsException;
import com.questrail.navigation.api.Position;
import com.questrail.navigation.api.RouteResult;
import com.questrail.navigation.api.RouteStatus;
import com.questrail.navigation.api.RouteStep;
import com.questrail.navigation.api.RunSummary;
import com.questrail.navigation.grid.Grid;
import com.questrail.navigation.grid.InvalidGridException;
import com.questrail.navigation.observability.DriverStateTransitionEvent;
import com.questrail.navigation.observability.NavigationErrorEvent;
import com.questrail.navigation.observability.NavigationObservabilitySink;
import com.questrail.navigation.observability.NullObservabilitySink;
import com.questrail.navigation.observability.RouteStepEvent;
import com.questrail.navigation.planner.HeuristicPlanner;
import com.questrail.navigation.protocol.step.StepProtocolAdapter;
import com.questrail.navigation.time.MonotonicClock;
import com.questrail.navigation.time.SystemMonotonicClock;
import com.questrail.navigation.time.SystemWallClock;
import com.questrail.navigation.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RouteDriver
 * =============================================================================
 * Runs the step loop of one planning run and owns its route and visited set.
 *
 * <h2>Loop</h2>
 * <pre>
 *   current = start, visited = {start}, route = []
 *   repeat:
 *     move = planner.nextMove(current, goal, grid ∧ ¬visited)
 *       Deadlock      → DEADLOCKED, partial route
 *       REACHED_GOAL  → append (goal, GOAL), acknowledge, COMPLETED
 *       directional   → append, mark visited, acknowledge, continue
 * </pre>
 *
 * <h2>Acknowledgement</h2>
 * When the attached {@link StepProtocolAdapter} is enabled, each appended
 * entry (the terminal one included) is exchanged with the controller before
 * the loop continues. The driver is in {@link DriverState#AWAITING_ACK} for the
 * duration. A failed exchange ends the run as
 * {@link DriverState#CONTROLLER_FAILED}; the entry whose exchange failed stays
 * on the route because the move was already committed locally.
 *
 * <h2>Termination</h2>
 * The number of directional moves is capped at {@code min(maxSteps, cells)}.
 * Under the no-revisit rule the cell count is never reached; a smaller
 * {@code maxSteps} ends the run as {@link DriverState#STEP_LIMIT_REACHED}.
 *
 * <h2>Ownership</h2>
 * Each run plans over a private {@link Grid#copy()}, so the caller's grid is
 * never mutated and repeated runs over the same grid produce identical routes.
 * One driver executes one run at a time; an overlapping {@link #plan} call is
 * rejected.
 *
 * <h2>Failures that propagate</h2>
 * A start or goal outside the grid raises {@link OutOfBoundsException}, one on
 * an occupied cell {@link InvalidGridException}. An
 * {@link com.questrail.navigation.api.InvalidTransitionException} means the
 * planner proposed a cell it must not enter and is rethrown as is. Both are
 * reported to the observability sink first, and the driver returns to
 * {@link DriverState#IDLE}.
 */
public final class RouteDriver
{
    private final HeuristicPlanner planner;
    private final StepProtocolAdapter stepProtocol;
    private final NavigationObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final int maxSteps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile DriverState state = DriverState.IDLE;

    /**
     * @param maxSteps upper bound on directional moves per run; {@code 0}
     *                 means the grid's cell count
     */
    public RouteDriver(HeuristicPlanner planner,
                       StepProtocolAdapter stepProtocol,
                       NavigationObservabilitySink observabilitySink,
                       MonotonicClock clock,
                       WallClock wallClock,
                       int maxSteps)
    {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative, got " + maxSteps);
        }
        this.planner = Objects.requireNonNull(planner, "planner");
        this.stepProtocol = Objects.requireNonNull(stepProtocol, "stepProtocol");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.maxSteps = maxSteps;
    }

    public RouteDriver(HeuristicPlanner planner, StepProtocolAdapter stepProtocol)
    {
        this(planner, stepProtocol, NullObservabilitySink.INSTANCE,
                SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, 0);
    }

    /**
     * A driver with the default planner and no controller channel.
     */
    public RouteDriver()
    {
        this(new HeuristicPlanner(), StepProtocolAdapter.disabled());
    }

    /**
     * Current state; the terminal state of the last run once it has ended.
     */
    public DriverState state()
    {
        return state;
    }

    /**
     * Plans from the grid's own start to its own goal.
     */
    public RouteResult plan(Grid grid)
    {
        Objects.requireNonNull(grid, "grid");
        return plan(grid, grid.start(), grid.goal());
    }

    /**
     * Runs one planning run to a terminal state.
     *
     * @return the result; never {@code null}. Deadlock, controller failure and
     *         the step limit are reported through it rather than thrown.
     * @throws OutOfBoundsException if {@code start} or {@code goal} lies outside the grid
     * @throws InvalidGridException if {@code start} or {@code goal} is an occupied cell
     * @throws IllegalStateException if a run is already in progress on this driver
     */
    public RouteResult plan(Grid grid, Position start, Position goal)
    {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");

        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A planning run is already in progress");
        }
        try {
            requireAvailable(grid, start, "start");
            requireAvailable(grid, goal, "goal");
            return new Run(grid.copy(), start, goal).execute();
        } catch (NavigationException e) {
            // Terminal outcomes are returned; anything reaching here is thrown to the caller.
            state = DriverState.IDLE;
            observabilitySink.onError(new NavigationErrorEvent(wallClock.now(), e.getMessage(), e));
            throw e;
        } finally {
            running.set(false);
        }
    }

    private static void requireAvailable(Grid grid, Position position, String role)
    {
        if (!grid.contains(position)) {
            throw new OutOfBoundsException(position, grid.rows(), grid.columns());
        }
        if (grid.statusAt(position) == CellStatus.OCCUPIED) {
            throw new InvalidGridException(role + " location " + position + " is not available: cell is OCCUPIED");
        }
    }

    private int stepLimitFor(Grid grid)
    {
        return maxSteps == 0 ? grid.cellCount() : Math.min(maxSteps, grid.cellCount());
    }

    /**
     * State of one run. Discarded when the run ends.
     */
    private final class Run
    {
        private final Grid grid;
        private final Position start;
        private final Position goal;
        private final int stepLimit;

        private final Set<Position> visited = new HashSet<>();
        private final List<RouteStep> route = new ArrayList<>();

        private final Instant startedAt;
        private final long startedNanos;

        private Position current;
        private int steps;

        Run(Grid grid, Position start, Position goal)
        {
            this.grid = grid;
            this.start = start;
            this.goal = goal;
            this.stepLimit = stepLimitFor(grid);
            this.current = start;
            this.visited.add(start);
            this.startedAt = wallClock.now();
            this.startedNanos = clock.nowNanos();
        }

        RouteResult execute()
        {
            state = DriverState.IDLE;
            transition(DriverState.STEPPING);

            while (true) {
                Move move;
                try {
                    move = planner.nextMove(current, goal, this::isTraversable);
                } catch (DeadlockException e) {
                    return fail(RouteStatus.DEADLOCKED, e);
                }

                if (move == Move.REACHED_GOAL) {
                    append(new RouteStep(goal, Move.REACHED_GOAL));
                    ControllerException failure = acknowledge(move);
                    if (failure != null) {
                        return fail(RouteStatus.CONTROLLER_FAILED, failure);
                    }
                    transition(DriverState.COMPLETED);
                    return RouteResult.completed(start, goal, route, summary());
                }

                if (steps >= stepLimit) {
                    return fail(RouteStatus.STEP_LIMIT_REACHED, new NavigationException(
                            "Goal " + goal + " not reached within " + stepLimit + " steps, stopped at " + current));
                }

                Position next = current.step(move);
                grid.markVisited(next);
                visited.add(next);
                current = next;
                steps++;
                append(new RouteStep(next, move));

                ControllerException failure = acknowledge(move);
                if (failure != null) {
                    return fail(RouteStatus.CONTROLLER_FAILED, failure);
                }
            }
        }

        private boolean isTraversable(Position position)
        {
            return grid.isTraversable(position) && !visited.contains(position);
        }

        private void append(RouteStep step)
        {
            Position from = route.isEmpty() ? start : route.get(route.size() - 1).position();
            route.add(step);
            observabilitySink.onRouteStep(new RouteStepEvent(wallClock.now(), route.size(), from, step));
        }

        /**
         * @return the failure, or {@code null} when acknowledged or no channel is attached
         */
        private ControllerException acknowledge(Move move)
        {
            if (!stepProtocol.isEnabled()) {
                return null;
            }
            transition(DriverState.AWAITING_ACK);
            try {
                stepProtocol.sendAndAwait(move);
            } catch (ControllerException e) {
                return e;
            }
            transition(DriverState.STEPPING);
            return null;
        }

        private RouteResult fail(RouteStatus status, NavigationException failure)
        {
            transition(DriverState.terminalFor(status));
            observabilitySink.onError(new NavigationErrorEvent(wallClock.now(), failure.getMessage(), failure));
            return RouteResult.failed(status, start, goal, route, current, failure, summary());
        }

        private RunSummary summary()
        {
            Duration elapsed = Duration.ofNanos(Math.max(0L, clock.nowNanos() - startedNanos));
            return new RunSummary(startedAt, wallClock.now(), elapsed, steps);
        }

        private void transition(DriverState next)
        {
            DriverState previous = state;
            state = next;
            observabilitySink.onStateTransition(new DriverStateTransitionEvent(
                    wallClock.now(), previous, next, current, steps));
        }
    }
}
