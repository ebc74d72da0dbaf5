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
import com.questrail.navigation.grid.Grid;
import com.questrail.navigation.grid.GridBuilder;
import com.questrail.navigation.grid.InvalidGridException;
import com.questrail.navigation.grid.io.CsvGridReader;
import com.questrail.navigation.observability.NavigationErrorEvent;
import com.questrail.navigation.observability.RecordingObservabilitySink;
import com.questrail.navigation.observability.RouteStepEvent;
import com.questrail.navigation.planner.HeuristicPlanner;
import com.questrail.navigation.protocol.step.Acknowledgement;
import com.questrail.navigation.protocol.step.StepProtocolAdapter;
import com.questrail.navigation.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RouteDriverTest
 * -----------------------------------------------------------------------------
 * Drives complete planning runs over small grids and checks the route, the
 * terminal status and the interaction with the step protocol.
 */
class RouteDriverTest {

    private RecordingObservabilitySink sink;
    private ManualMonotonicClock clock;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        clock = new ManualMonotonicClock(1_000_000L);
    }

    private RouteDriver driver(StepProtocolAdapter adapter, int maxSteps) {
        return new RouteDriver(new HeuristicPlanner(), adapter, sink, clock, () -> Instant.EPOCH, maxSteps);
    }

    private RouteDriver driver(StepProtocolAdapter adapter) {
        return driver(adapter, 0);
    }

    private static Grid open(int rows, int columns, Position start, Position goal) {
        return new GridBuilder(rows, columns).start(start).goal(goal).build();
    }

    /**
     * Records every command and acknowledges it immediately; optionally fails
     * the n-th exchange (1-based).
     */
    private static final class ScriptedAdapter implements StepProtocolAdapter {
        final List<Move> sent = new ArrayList<>();
        private final int failOnExchange;

        ScriptedAdapter(int failOnExchange) {
            this.failOnExchange = failOnExchange;
        }

        ScriptedAdapter() {
            this(-1);
        }

        @Override
        public Acknowledgement sendAndAwait(Move move) {
            sent.add(move);
            if (sent.size() == failOnExchange) {
                throw new ControllerException(move, "controller disconnected");
            }
            return new Acknowledgement(move, "ok", Duration.ZERO);
        }
    }

    // ---------------------------------------------------------------------
    // Route shape
    // ---------------------------------------------------------------------

    @Test
    void openGridRouteIsManhattanLength() {
        Position start = new Position(2, 2);
        Position goal = new Position(21, 19);
        RouteResult result = driver(StepProtocolAdapter.disabled()).plan(open(24, 22, start, goal));

        assertEquals(RouteStatus.COMPLETED, result.status());
        assertEquals(36, result.summary().steps());
        assertEquals(37, result.steps().size());
        assertEquals(goal, result.finalPosition());

        long downs = result.steps().stream().filter(s -> s.move() == Move.DOWN).count();
        long rights = result.steps().stream().filter(s -> s.move() == Move.RIGHT).count();
        assertEquals(19, downs);
        assertEquals(17, rights);
    }

    @Test
    void openGridFollowsPrimaryAxisUntilDeltasBalance() {
        RouteResult result = driver(StepProtocolAdapter.disabled())
                .plan(open(10, 10, new Position(0, 0), new Position(5, 2)));

        List<Move> moves = result.steps().stream().map(RouteStep::move).toList();
        assertEquals(List.of(Move.DOWN, Move.DOWN, Move.DOWN, Move.DOWN, Move.RIGHT, Move.DOWN, Move.RIGHT,
                Move.REACHED_GOAL), moves);
    }

    @Test
    void routePositionsAreDistinctUnitSteps() throws URISyntaxException {
        Grid grid = new CsvGridReader().read(fixture("corridor.csv")).build();
        RouteResult result = driver(StepProtocolAdapter.disabled()).plan(grid);

        assertTrue(result.isCompleted());
        assertEquals(14, result.summary().steps());

        Set<Position> seen = new HashSet<>();
        seen.add(result.start());
        Position previous = result.start();
        for (Position p : result.positions()) {
            assertTrue(seen.add(p), "revisited " + p);
            assertTrue(previous.isAdjacentTo(p), previous + " -> " + p);
            assertTrue(grid.isTraversable(p));
            previous = p;
        }
        assertEquals(grid.goal(), previous);
    }

    @Test
    void completedRouteEndsWithExactlyOneTerminalEntry() {
        RouteResult result = driver(StepProtocolAdapter.disabled())
                .plan(open(5, 5, new Position(0, 0), new Position(4, 4)));

        List<RouteStep> steps = result.steps();
        assertEquals(1, steps.stream().filter(RouteStep::isTerminal).count());
        assertTrue(steps.get(steps.size() - 1).isTerminal());
        assertEquals(new Position(4, 4), steps.get(steps.size() - 1).position());
    }

    @Test
    void startEqualToGoalYieldsOnlyTheTerminalEntry() {
        Position p = new Position(3, 3);
        ScriptedAdapter adapter = new ScriptedAdapter();
        RouteResult result = driver(adapter).plan(open(6, 6, p, p));

        assertTrue(result.isCompleted());
        assertEquals(List.of(new RouteStep(p, Move.REACHED_GOAL)), result.steps());
        assertEquals(0, result.summary().steps());
        assertEquals(List.of(Move.REACHED_GOAL), adapter.sent);
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void enclosedStartDeadlocksAtStepZero() {
        Position start = new Position(2, 2);
        Grid grid = new GridBuilder(5, 5)
                .occupy(new Position(1, 2))
                .occupy(new Position(3, 2))
                .occupy(new Position(2, 1))
                .occupy(new Position(2, 3))
                .start(start)
                .goal(new Position(4, 4))
                .build();

        RouteResult result = driver(StepProtocolAdapter.disabled()).plan(grid);

        assertEquals(RouteStatus.DEADLOCKED, result.status());
        assertTrue(result.steps().isEmpty());
        assertEquals(start, result.finalPosition());
        DeadlockException e = assertInstanceOf(DeadlockException.class, result.failure().orElseThrow());
        assertEquals(start, e.stalledAt());
    }

    @Test
    void deadEndReturnsPartialRoute() throws URISyntaxException {
        Grid grid = new CsvGridReader().read(fixture("dead-end.csv")).build();
        RouteResult result = driver(StepProtocolAdapter.disabled()).plan(grid);

        assertEquals(RouteStatus.DEADLOCKED, result.status());
        assertEquals(List.of(new Position(1, 2), new Position(1, 3), new Position(1, 4),
                new Position(2, 4), new Position(3, 4)), result.positions());
        assertEquals(new Position(3, 4), result.finalPosition());
        assertEquals(DriverState.DEADLOCKED, driverAfter(grid).state());
        assertTrue(sink.hasEventOfType(NavigationErrorEvent.class));
    }

    private RouteDriver driverAfter(Grid grid) {
        RouteDriver d = driver(StepProtocolAdapter.disabled());
        d.plan(grid);
        return d;
    }

    @Test
    void controllerFailureStopsBeforeTheNextStep() {
        ScriptedAdapter adapter = new ScriptedAdapter(3);
        RouteResult result = driver(adapter).plan(open(6, 6, new Position(0, 0), new Position(5, 5)));

        assertEquals(RouteStatus.CONTROLLER_FAILED, result.status());
        assertEquals(3, result.steps().size());
        assertEquals(3, adapter.sent.size());
        assertEquals(result.steps().get(2).position(), result.finalPosition());
        ControllerException e = assertInstanceOf(ControllerException.class, result.failure().orElseThrow());
        assertEquals(adapter.sent.get(2), e.move().orElseThrow());
    }

    @Test
    void controllerFailureOnGoalCommandFailsTheRun() {
        ScriptedAdapter adapter = new ScriptedAdapter(3);
        RouteResult result = driver(adapter).plan(open(1, 3, new Position(0, 0), new Position(0, 2)));

        assertEquals(RouteStatus.CONTROLLER_FAILED, result.status());
        assertEquals(List.of(Move.RIGHT, Move.RIGHT, Move.REACHED_GOAL), adapter.sent);
        assertEquals(new Position(0, 2), result.finalPosition());
    }

    @Test
    void stepLimitEndsTheRun() {
        RouteResult result = driver(StepProtocolAdapter.disabled(), 3)
                .plan(open(8, 8, new Position(0, 0), new Position(7, 7)));

        assertEquals(RouteStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(3, result.summary().steps());
        assertEquals(3, result.steps().size());
        assertTrue(result.failure().isPresent());
    }

    @Test
    void stepLimitDoesNotPreventReachingGoalOnTheLastAllowedMove() {
        RouteResult result = driver(StepProtocolAdapter.disabled(), 2)
                .plan(open(3, 3, new Position(0, 0), new Position(1, 1)));

        assertTrue(result.isCompleted());
        assertEquals(2, result.summary().steps());
    }

    @Test
    void endpointsOutsideGridAreRejected() {
        Grid grid = open(3, 3, new Position(0, 0), new Position(2, 2));
        RouteDriver d = driver(StepProtocolAdapter.disabled());

        OutOfBoundsException e = assertThrows(OutOfBoundsException.class,
                () -> d.plan(grid, new Position(5, 0), new Position(2, 2)));
        assertEquals(new Position(5, 0), e.position());
        assertThrows(OutOfBoundsException.class, () -> d.plan(grid, new Position(0, 0), new Position(0, -1)));
        assertTrue(sink.hasEventOfType(NavigationErrorEvent.class));
    }

    @Test
    void occupiedEndpointsAreRejected() {
        Grid grid = new GridBuilder(3, 3)
                .occupy(new Position(0, 0))
                .occupy(new Position(2, 2))
                .start(new Position(1, 0))
                .goal(new Position(1, 2))
                .build();
        RouteDriver d = driver(StepProtocolAdapter.disabled());

        InvalidGridException e = assertThrows(InvalidGridException.class,
                () -> d.plan(grid, new Position(0, 0), new Position(1, 2)));
        assertTrue(e.getMessage().contains("start"), e.getMessage());
        assertThrows(InvalidGridException.class, () -> d.plan(grid, new Position(1, 0), new Position(2, 2)));
        assertEquals(2, sink.eventsOfType(NavigationErrorEvent.class).size());
        assertTrue(sink.eventsOfType(RouteStepEvent.class).isEmpty());
    }

    @Test
    void driverReturnsToIdleWhenARunThrows() {
        StepProtocolAdapter broken = move -> {
            throw new NavigationException("controller sent garbage state");
        };
        RouteDriver d = driver(broken);

        assertThrows(NavigationException.class,
                () -> d.plan(open(3, 3, new Position(0, 0), new Position(2, 2))));
        assertEquals(DriverState.IDLE, d.state());
    }

    @Test
    void controllerFailureIsReportedOnce() {
        driver(new ScriptedAdapter(2)).plan(open(4, 4, new Position(0, 0), new Position(3, 3)));

        assertEquals(1, sink.eventsOfType(NavigationErrorEvent.class).size());
    }

    // ---------------------------------------------------------------------
    // Step protocol interaction
    // ---------------------------------------------------------------------

    @Test
    void everyEntryIsAcknowledgedInOrder() {
        ScriptedAdapter adapter = new ScriptedAdapter();
        RouteResult result = driver(adapter).plan(open(4, 4, new Position(0, 0), new Position(2, 3)));

        List<Move> routed = result.steps().stream().map(RouteStep::move).toList();
        assertEquals(routed, adapter.sent);
        assertEquals(Move.REACHED_GOAL, adapter.sent.get(adapter.sent.size() - 1));
    }

    @Test
    void stateMachineAlternatesThroughAwaitingAck() {
        driver(new ScriptedAdapter()).plan(open(1, 2, new Position(0, 0), new Position(0, 1)));

        List<DriverState> states = sink.getStateTransitions().stream()
                .map(e -> e.newState())
                .toList();
        assertEquals(List.of(
                DriverState.STEPPING,
                DriverState.AWAITING_ACK, DriverState.STEPPING,
                DriverState.AWAITING_ACK, DriverState.STEPPING,
                DriverState.COMPLETED), states);
        assertEquals(DriverState.IDLE, sink.getStateTransitions().get(0).oldState());
    }

    @Test
    void disabledAdapterNeverAwaits() {
        RouteDriver d = driver(StepProtocolAdapter.disabled());
        assertEquals(DriverState.IDLE, d.state());
        d.plan(open(3, 3, new Position(0, 0), new Position(2, 2)));

        assertEquals(DriverState.COMPLETED, d.state());
        assertTrue(sink.getStateTransitions().stream().noneMatch(e -> e.newState() == DriverState.AWAITING_ACK));
    }

    @Test
    void blockedAcknowledgementHoldsTheRoute() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StepProtocolAdapter blocking = move -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ControllerException(move, "interrupted", e);
            }
            return new Acknowledgement(move, "ok", Duration.ZERO);
        };

        RouteDriver d = driver(blocking);
        AtomicReference<RouteResult> result = new AtomicReference<>();
        Thread runner = new Thread(() -> result.set(d.plan(open(1, 4, new Position(0, 0), new Position(0, 3)))));
        runner.start();

        assertTrue(entered.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(DriverState.AWAITING_ACK, d.state());
        assertEquals(1, sink.eventsOfType(RouteStepEvent.class).size());

        assertThrows(IllegalStateException.class,
                () -> d.plan(open(2, 2, new Position(0, 0), new Position(1, 1))));

        release.countDown();
        runner.join(2000);
        assertFalse(runner.isAlive());
        assertTrue(result.get().isCompleted());
        assertEquals(3, result.get().summary().steps());
    }

    // ---------------------------------------------------------------------
    // Idempotence and summary
    // ---------------------------------------------------------------------

    @Test
    void planningTwiceYieldsTheSameRouteAndLeavesGridUntouched() throws URISyntaxException {
        Grid grid = new CsvGridReader().read(fixture("corridor.csv")).build();
        RouteDriver d = driver(StepProtocolAdapter.disabled());

        RouteResult first = d.plan(grid);
        RouteResult second = d.plan(grid);

        assertEquals(first.steps(), second.steps());
        assertEquals(first.status(), second.status());
        assertEquals(0, grid.count(CellStatus.VISITED));
    }

    @Test
    void summaryMeasuresElapsedOnMonotonicClock() {
        RouteResult result = driver(StepProtocolAdapter.disabled())
                .plan(open(2, 2, new Position(0, 0), new Position(1, 1)));

        assertTrue(result.summary().elapsed().compareTo(Duration.ZERO) > 0);
        assertEquals(Instant.EPOCH, result.summary().startedAt());
    }

    @Test
    void routeStepEventsTrackEachEntry() {
        driver(StepProtocolAdapter.disabled()).plan(open(1, 3, new Position(0, 0), new Position(0, 2)));

        List<RouteStepEvent> events = sink.eventsOfType(RouteStepEvent.class);
        assertEquals(3, events.size());
        assertEquals(new Position(0, 0), events.get(0).from());
        assertEquals(1, events.get(0).stepIndex());
        assertEquals(Move.REACHED_GOAL, events.get(2).step().move());
    }

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(
                RouteDriverTest.class.getResource("/maps/" + name), name).toURI());
    }
}
