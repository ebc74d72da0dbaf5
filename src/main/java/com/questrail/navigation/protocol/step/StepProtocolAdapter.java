package com.questrail.navigation.protocol.step;

import com.questrail.navigation.api.ControllerException;
import com.questrail.navigation.api.Move;

/**
 * StepProtocolAdapter
 * -----------------------------------------------------------------------------
 * Capability through which the route driver hands each decided move to an
 * external executor and waits until the executor confirms it.
 *
 * <h2>Lock-step contract</h2>
 * Every call performs exactly one send followed by exactly one blocking
 * receive. Two exchanges are never in flight at once; an implementation must
 * reject an overlapping call with {@link IllegalStateException}. The next
 * planning decision depends on the physical move having completed, so the
 * driver does not continue until this method returns.
 *
 * <h2>Failure</h2>
 * Any channel-level failure (transport down, malformed acknowledgement,
 * interrupted or timed-out wait) surfaces as {@link ControllerException} and
 * is fatal to the planning run.
 *
 * <p>Implementations may be backed by a datagram transport, an in-process
 * simulator, or a test stub that acknowledges immediately.</p>
 */
public interface StepProtocolAdapter
{
    /**
     * Sends the move's command token and blocks for its acknowledgement.
     *
     * @param move the decided move, including the terminal {@link Move#REACHED_GOAL}
     * @return the acknowledgement
     * @throws ControllerException if the exchange fails
     */
    Acknowledgement sendAndAwait(Move move);

    /**
     * Whether this adapter talks to a real executor. When {@code false} the
     * driver skips the exchange entirely and never enters its awaiting state.
     */
    default boolean isEnabled()
    {
        return true;
    }

    /**
     * The no-op adapter used when no external channel is configured.
     */
    static StepProtocolAdapter disabled()
    {
        return DisabledStepProtocolAdapter.INSTANCE;
    }
}
