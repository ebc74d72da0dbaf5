package com.questrail.navigation.driver;

import com.questrail.navigation.api.RouteStatus;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DriverStateTest {

    @Test
    void onlyOutcomeStatesAreTerminal() {
        assertFalse(DriverState.IDLE.isTerminal());
        assertFalse(DriverState.STEPPING.isTerminal());
        assertFalse(DriverState.AWAITING_ACK.isTerminal());
        assertTrue(DriverState.COMPLETED.isTerminal());
        assertTrue(DriverState.DEADLOCKED.isTerminal());
        assertTrue(DriverState.CONTROLLER_FAILED.isTerminal());
        assertTrue(DriverState.STEP_LIMIT_REACHED.isTerminal());
    }

    @Test
    void terminalStatesMapOneToOneOntoRouteStatus() {
        for (RouteStatus status : RouteStatus.values()) {
            DriverState state = DriverState.terminalFor(status);
            assertEquals(Optional.of(status), state.routeStatus());
        }
        assertEquals(Optional.empty(), DriverState.STEPPING.routeStatus());
    }
}
