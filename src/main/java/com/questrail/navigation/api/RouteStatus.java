package com.questrail.navigation.api;

/**
 * RouteStatus
 * -----------------------------------------------------------------------------
 * Terminal outcome of one planning run.
 *
 * <p>Every status other than {@link #COMPLETED} comes with a partial route and
 * a failure describing where the run stopped.</p>
 */
public enum RouteStatus
{
    /** The goal was reached and the terminal {@code GOAL} step was emitted. */
    COMPLETED,

    /** No candidate move was traversable from the current position. */
    DEADLOCKED,

    /** The external controller channel failed; the run was aborted. */
    CONTROLLER_FAILED,

    /** The configured step budget ran out before the goal was reached. */
    STEP_LIMIT_REACHED;

    public boolean isSuccess()
    {
        return this == COMPLETED;
    }
}
