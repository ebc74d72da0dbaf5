package com.questrail.navigation.observability;

/**
 * Main interface for receiving navigation observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are delivered synchronously on the planning thread, except
 * transport events, which arrive on the transport's own thread.</p>
 */
public interface NavigationObservabilitySink {
    /**
     * Called when the route driver changes state.
     */
    void onStateTransition(DriverStateTransitionEvent event);

    /**
     * Called after the driver appends an entry to the route.
     */
    void onRouteStep(RouteStepEvent event);

    /**
     * Called after an acknowledgement for a command has been received.
     */
    void onStepExchange(StepExchangeEvent event);

    /**
     * Called when a controller channel endpoint goes up or down.
     */
    void onTransportEvent(StepTransportEvent event);

    /**
     * Called when a run fails or the channel misbehaves.
     */
    void onError(NavigationErrorEvent event);
}
