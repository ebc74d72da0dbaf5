package com.questrail.navigation.runtime;

import com.questrail.navigation.api.RouteResult;
import com.questrail.navigation.config.NavigationConfig;
import com.questrail.navigation.driver.RouteDriver;
import com.questrail.navigation.grid.Grid;
import com.questrail.navigation.grid.io.CsvGridReader;
import com.questrail.navigation.observability.NavigationObservabilitySink;
import com.questrail.navigation.observability.NullObservabilitySink;
import com.questrail.navigation.planner.HeuristicPlanner;
import com.questrail.navigation.protocol.step.DatagramStepProtocolAdapter;
import com.questrail.navigation.protocol.step.StepCommandCodec;
import com.questrail.navigation.protocol.step.StepProtocolAdapter;
import com.questrail.navigation.protocol.step.transport.DatagramEndpoint;
import com.questrail.navigation.protocol.step.transport.udp.netty.NettyUdpDatagramEndpoint;
import com.questrail.navigation.time.MonotonicClock;
import com.questrail.navigation.time.SystemMonotonicClock;
import com.questrail.navigation.time.SystemWallClock;
import com.questrail.navigation.time.WallClock;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Function;

/**
 * NavigationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a navigation run.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   CsvGridReader → Grid
 *   HeuristicPlanner ─┐
 *   StepProtocolAdapter ─┴→ RouteDriver → RouteResult
 * </pre>
 *
 * <p>With the controller channel enabled the adapter is a
 * {@link DatagramStepProtocolAdapter} over two datagram endpoints: one bound to
 * an ephemeral port for sending commands, one bound to the configured response
 * address for receiving acknowledgements. Otherwise it is
 * {@link StepProtocolAdapter#disabled()} and nothing is opened.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()     → brings the controller channel up (if enabled)
 *   runtime.run(grid)   → one planning run; may be called repeatedly
 *   runtime.stop()      → releases the channel
 * </pre>
 */
public final class NavigationRuntime
{
    private final NavigationConfig config;
    private final RouteDriver driver;
    private final DatagramStepProtocolAdapter channel;
    private final CsvGridReader gridReader;

    private NavigationRuntime(NavigationConfig config,
                              RouteDriver driver,
                              DatagramStepProtocolAdapter channel,
                              CsvGridReader gridReader)
    {
        this.config = config;
        this.driver = driver;
        this.channel = channel;
        this.gridReader = gridReader;
    }

    public NavigationConfig config()
    {
        return config;
    }

    public RouteDriver driver()
    {
        return driver;
    }

    public boolean isControllerEnabled()
    {
        return channel != null;
    }

    /**
     * Reads the configured map and applies the configured start and goal.
     */
    public Grid loadGrid()
    {
        return gridReader.load(config.mapPath(), config.start(), config.goal());
    }

    public void start()
    {
        if (channel != null) {
            channel.start();
        }
    }

    /**
     * Plans from the grid's start to its goal.
     */
    public RouteResult run(Grid grid)
    {
        return driver.plan(grid);
    }

    public void stop()
    {
        if (channel != null) {
            channel.stop();
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private NavigationConfig config = NavigationConfig.defaults();
        private NavigationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Function<InetSocketAddress, DatagramEndpoint> endpointFactory = NettyUdpDatagramEndpoint::new;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private HeuristicPlanner planner = new HeuristicPlanner();

        public Builder withConfig(NavigationConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(NavigationObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces how datagram endpoints are created from their bind address.
         */
        public Builder withEndpointFactory(Function<InetSocketAddress, DatagramEndpoint> factory)
        {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClocks(MonotonicClock clock, WallClock wallClock)
        {
            this.clock = clock;
            this.wallClock = wallClock;
            return this;
        }

        public Builder withPlanner(HeuristicPlanner planner)
        {
            this.planner = planner;
            return this;
        }

        public NavigationRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(planner, "planner");

            DatagramStepProtocolAdapter channel = null;
            StepProtocolAdapter stepProtocol = StepProtocolAdapter.disabled();
            if (config.controllerEnabled()) {
                DatagramEndpoint commandEndpoint = endpointFactory.apply(new InetSocketAddress(0));
                DatagramEndpoint acknowledgementEndpoint = endpointFactory.apply(config.responseEndpoint());
                channel = new DatagramStepProtocolAdapter(
                        commandEndpoint,
                        acknowledgementEndpoint,
                        config.targetEndpoint(),
                        new StepCommandCodec(),
                        config.timingPolicy(),
                        observabilitySink,
                        clock,
                        wallClock);
                stepProtocol = channel;
            }

            RouteDriver driver = new RouteDriver(
                    planner,
                    stepProtocol,
                    observabilitySink,
                    clock,
                    wallClock,
                    config.maxSteps());

            return new NavigationRuntime(config, driver, channel, new CsvGridReader());
        }
    }
}
