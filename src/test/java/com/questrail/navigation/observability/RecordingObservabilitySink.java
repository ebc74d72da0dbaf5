package com.questrail.navigation.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements NavigationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(DriverStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRouteStep(RouteStepEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStepExchange(StepExchangeEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(StepTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(NavigationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<DriverStateTransitionEvent> getStateTransitions() {
        return eventsOfType(DriverStateTransitionEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
