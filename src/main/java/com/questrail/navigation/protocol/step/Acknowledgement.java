package com.questrail.navigation.protocol.step;

import com.questrail.navigation.api.Move;

import java.time.Duration;
import java.util.Objects;

/**
 * Confirmation that the external controller executed a command.
 *
 * <p>The payload is not interpreted beyond "received"; it is kept for
 * display and logging.</p>
 *
 * @param move    the command being acknowledged
 * @param payload acknowledgement text as decoded from the wire
 * @param waited  time spent blocked waiting for it
 */
public record Acknowledgement(Move move, String payload, Duration waited)
{
    public Acknowledgement {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(waited, "waited");
    }

    /**
     * Acknowledgement produced without any exchange, used when no external
     * controller is attached.
     */
    public static Acknowledgement implicit(Move move)
    {
        return new Acknowledgement(move, "", Duration.ZERO);
    }
}
