package com.questrail.navigation.driver;

import com.questrail.navigation.api.RouteStatus;

import java.util.Optional;

/**
 * DriverState
 * -----------------------------------------------------------------------------
 * Authoritative lifecycle of one {@link RouteDriver} run.
 *
 * <pre>
 *   IDLE → STEPPING ⇄ AWAITING_ACK → { STEPPING | COMPLETED | DEADLOCKED
 *                                     | CONTROLLER_FAILED | STEP_LIMIT_REACHED }
 * </pre>
 *
 * <p>{@code AWAITING_ACK} is only entered when an enabled step protocol
 * adapter is attached. Terminal states map one-to-one onto
 * {@link RouteStatus}.</p>
 */
public enum DriverState
{
    IDLE,
    STEPPING,
    AWAITING_ACK,
    COMPLETED,
    DEADLOCKED,
    CONTROLLER_FAILED,
    STEP_LIMIT_REACHED;

    public boolean isTerminal()
    {
        return routeStatus().isPresent();
    }

    /**
     * Route status reported for a terminal state; empty for non-terminal ones.
     */
    public Optional<RouteStatus> routeStatus()
    {
        return switch (this) {
            case COMPLETED -> Optional.of(RouteStatus.COMPLETED);
            case DEADLOCKED -> Optional.of(RouteStatus.DEADLOCKED);
            case CONTROLLER_FAILED -> Optional.of(RouteStatus.CONTROLLER_FAILED);
            case STEP_LIMIT_REACHED -> Optional.of(RouteStatus.STEP_LIMIT_REACHED);
            case IDLE, STEPPING, AWAITING_ACK -> Optional.empty();
        };
    }

    public static DriverState terminalFor(RouteStatus status)
    {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case DEADLOCKED -> DEADLOCKED;
            case CONTROLLER_FAILED -> CONTROLLER_FAILED;
            case STEP_LIMIT_REACHED -> STEP_LIMIT_REACHED;
        };
    }
}
