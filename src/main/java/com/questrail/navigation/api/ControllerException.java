package com.questrail.navigation.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ControllerException
 * -----------------------------------------------------------------------------
 * The external controller channel failed during a step exchange.
 *
 * <p>Covers a transport that is down or goes down, a malformed acknowledgement,
 * an acknowledgement wait that exceeded its bound, and an interrupted wait.
 * It is fatal to the current planning run.</p>
 */
public final class ControllerException extends NavigationException
{
    private final Move move;

    public ControllerException(Move move, String message)
    {
        super(formatMessage(move, message));
        this.move = move;
    }

    public ControllerException(Move move, String message, Throwable cause)
    {
        super(formatMessage(move, message), cause);
        this.move = move;
    }

    /**
     * Failure of the channel itself, outside any step exchange.
     */
    public ControllerException(String message, Throwable cause)
    {
        super(Objects.requireNonNull(message, "message"), cause);
        this.move = null;
    }

    /**
     * The command whose exchange failed; empty when the channel failed before
     * any exchange.
     */
    public Optional<Move> move()
    {
        return Optional.ofNullable(move);
    }

    private static String formatMessage(Move move, String message)
    {
        return "[" + Objects.requireNonNull(move, "move").token() + "] "
                + Objects.requireNonNull(message, "message");
    }
}
