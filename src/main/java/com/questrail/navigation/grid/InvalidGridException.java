package com.questrail.navigation.grid;

import com.questrail.navigation.api.NavigationException;

/**
 * A grid could not be assembled: ragged or empty shape, missing or duplicate
 * start/goal markers, or an endpoint placed on an unavailable cell.
 */
public class InvalidGridException extends NavigationException
{
    public InvalidGridException(String message)
    {
        super(message);
    }

    public InvalidGridException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
