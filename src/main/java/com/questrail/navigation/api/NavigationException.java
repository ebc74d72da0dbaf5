package com.questrail.navigation.api;

/**
 * NavigationException
 * -----------------------------------------------------------------------------
 * Root of the failure taxonomy for a planning run.
 *
 * <p>Every subclass is terminal to the run that raised it. Nothing in the
 * planner or driver retries or recovers locally; callers learn which failure
 * occurred from the concrete type and from {@link RouteResult#failure()}.</p>
 */
public class NavigationException extends RuntimeException
{
    public NavigationException(String message)
    {
        super(message);
    }

    public NavigationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
