package com.questrail.navigation.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteResultTest {

    private static final RunSummary SUMMARY =
            new RunSummary(Instant.EPOCH, Instant.EPOCH, Duration.ZERO, 2);

    @Test
    void completedResultHasNoFailureAndEndsAtGoal() {
        Position start = new Position(0, 0);
        Position goal = new Position(0, 2);
        RouteResult result = RouteResult.completed(start, goal, List.of(
                new RouteStep(new Position(0, 1), Move.RIGHT),
                new RouteStep(goal, Move.RIGHT),
                new RouteStep(goal, Move.REACHED_GOAL)), SUMMARY);

        assertTrue(result.isCompleted());
        assertTrue(result.failure().isEmpty());
        assertEquals(goal, result.finalPosition());
        assertEquals(List.of(new Position(0, 1), goal), result.positions());
        assertTrue(result.steps().get(2).isTerminal());
    }

    @Test
    void failedResultRequiresAFailure() {
        Position start = new Position(1, 1);
        DeadlockException deadlock = new DeadlockException(start, new Position(3, 3));
        RouteResult result = RouteResult.failed(RouteStatus.DEADLOCKED, start, new Position(3, 3),
                List.of(), start, deadlock, SUMMARY);

        assertFalse(result.isCompleted());
        assertSame(deadlock, result.failure().orElseThrow());
        assertThrows(NullPointerException.class, () -> RouteResult.failed(RouteStatus.DEADLOCKED,
                start, start, List.of(), start, null, SUMMARY));
    }

    @Test
    void completedStatusCannotCarryAFailure() {
        Position p = new Position(0, 0);
        assertThrows(IllegalArgumentException.class, () -> RouteResult.failed(RouteStatus.COMPLETED,
                p, p, List.of(), p, new NavigationException("x"), SUMMARY));
    }

    @Test
    void routeIsImmutable() {
        Position p = new Position(0, 0);
        RouteResult result = RouteResult.completed(p, p, List.of(new RouteStep(p, Move.REACHED_GOAL)), SUMMARY);
        assertThrows(UnsupportedOperationException.class,
                () -> result.steps().add(new RouteStep(p, Move.UP)));
    }

    @Test
    void summaryRejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new RunSummary(Instant.EPOCH, Instant.EPOCH, Duration.ofMillis(-1), 0));
        assertThrows(IllegalArgumentException.class,
                () -> new RunSummary(Instant.EPOCH, Instant.EPOCH, Duration.ZERO, -1));
    }
}
