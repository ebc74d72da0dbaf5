package com.questrail.navigation.protocol.step;

import com.questrail.navigation.api.Move;

import java.util.Objects;

/**
 * No-op {@link StepProtocolAdapter}: sends nothing and acknowledges every
 * move immediately.
 */
final class DisabledStepProtocolAdapter implements StepProtocolAdapter
{
    static final DisabledStepProtocolAdapter INSTANCE = new DisabledStepProtocolAdapter();

    private DisabledStepProtocolAdapter() {}

    @Override
    public Acknowledgement sendAndAwait(Move move)
    {
        return Acknowledgement.implicit(Objects.requireNonNull(move, "move"));
    }

    @Override
    public boolean isEnabled()
    {
        return false;
    }
}
