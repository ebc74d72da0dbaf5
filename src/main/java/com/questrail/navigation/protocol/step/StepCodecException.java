package com.questrail.navigation.protocol.step;

/**
 * Indicates that a datagram could not be translated into a command token or
 * an acknowledgement.
 *
 * This typically reflects:
 * <ul>
 *   <li>An empty acknowledgement payload</li>
 *   <li>A payload that is not valid UTF-8</li>
 *   <li>A command datagram carrying an unknown token</li>
 * </ul>
 */
public final class StepCodecException extends RuntimeException
{
    public StepCodecException(String message) {
        super(message);
    }

    public StepCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
