package com.questrail.navigation.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NavigationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNavigationObservabilitySink implements NavigationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNavigationObservabilitySink.class);

    @Override
    public void onStateTransition(DriverStateTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("Route {} at {} after {} steps",
                event.newState(),
                event.position(),
                event.steps());
        }
        else if (event.oldState() != event.newState()) {
            log.debug("Driver State: {} -> {} at {}",
                event.oldState(),
                event.newState(),
                event.position());
        }
    }

    @Override
    public void onRouteStep(RouteStepEvent event) {
        log.info("Step {}: {} {} -> {}",
            event.stepIndex(),
            event.step().move().token(),
            event.from(),
            event.step().position());
    }

    @Override
    public void onStepExchange(StepExchangeEvent event) {
        log.debug("Controller acknowledged {} with '{}' after {} ms",
            event.move().token(),
            event.acknowledgement(),
            event.waited().toMillis());
    }

    @Override
    public void onTransportEvent(StepTransportEvent event) {
        if (event.up()) {
            log.info("Controller {} endpoint up", event.endpoint());
        }
        else if (event.cause() != null) {
            log.warn("Controller {} endpoint down: {}", event.endpoint(), event.cause().toString());
        }
        else {
            log.info("Controller {} endpoint down", event.endpoint());
        }
    }

    @Override
    public void onError(NavigationErrorEvent event) {
        log.error("Navigation Error: {}", event.message(), event.cause());
    }
}
