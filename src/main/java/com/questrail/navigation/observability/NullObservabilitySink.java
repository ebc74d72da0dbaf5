package com.questrail.navigation.observability;

/**
 * No-op implementation of NavigationObservabilitySink.
 */
public final class NullObservabilitySink implements NavigationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(DriverStateTransitionEvent event) {}

    @Override
    public void onRouteStep(RouteStepEvent event) {}

    @Override
    public void onStepExchange(StepExchangeEvent event) {}

    @Override
    public void onTransportEvent(StepTransportEvent event) {}

    @Override
    public void onError(NavigationErrorEvent event) {}
}
