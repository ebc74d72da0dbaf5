package com.questrail.navigation.protocol.step;

import com.questrail.navigation.api.ControllerException;
import com.questrail.navigation.api.Move;
import com.questrail.navigation.observability.NavigationObservabilitySink;
import com.questrail.navigation.observability.NullObservabilitySink;
import com.questrail.navigation.observability.StepExchangeEvent;
import com.questrail.navigation.observability.StepTransportEvent;
import com.questrail.navigation.protocol.step.transport.DatagramEndpoint;
import com.questrail.navigation.protocol.step.transport.DatagramEndpointListener;
import com.questrail.navigation.time.MonotonicClock;
import com.questrail.navigation.time.SystemMonotonicClock;
import com.questrail.navigation.time.SystemWallClock;
import com.questrail.navigation.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DatagramStepProtocolAdapter
 * =============================================================================
 * {@link StepProtocolAdapter} over two datagram endpoints: an outbound
 * <em>command</em> endpoint that sends tokens to the controller, and an inbound
 * <em>acknowledgement</em> endpoint the controller answers on.
 *
 * <h2>Exchange</h2>
 * <pre>
 *   sendAndAwait(move)
 *      → discard stale inbound datagrams
 *      → StepCommandCodec.encode(move)
 *      → commandEndpoint.send(controllerAddress, bytes)
 *      → block on the inbox until one datagram (or a transport-down signal) arrives
 *      → StepCommandCodec.decodeAcknowledgement(bytes)
 * </pre>
 *
 * <h2>Threading</h2>
 * Endpoint callbacks arrive on transport threads and only ever enqueue into
 * the inbox. The planning thread is the only consumer. An overlapping
 * {@link #sendAndAwait(Move)} is rejected, so at most one command is ever in
 * flight.
 *
 * <h2>Stale acknowledgements</h2>
 * Datagrams that arrive while no command is pending cannot belong to the next
 * command. They are dropped (and logged) before each send, which keeps one
 * send paired with exactly one receive.
 *
 * <h2>Failures</h2>
 * All of the following raise {@link ControllerException}:
 * <ul>
 *   <li>sending while either endpoint is down</li>
 *   <li>either endpoint going down while waiting</li>
 *   <li>a malformed acknowledgement (empty or not UTF-8)</li>
 *   <li>the wait exceeding {@link StepTimingPolicy#acknowledgementTimeout()}</li>
 *   <li>the waiting thread being interrupted</li>
 * </ul>
 */
public final class DatagramStepProtocolAdapter implements StepProtocolAdapter, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(DatagramStepProtocolAdapter.class);

    static final String COMMAND_ENDPOINT = "command";
    static final String ACKNOWLEDGEMENT_ENDPOINT = "acknowledgement";

    private final DatagramEndpoint commandEndpoint;
    private final DatagramEndpoint acknowledgementEndpoint;
    private final SocketAddress controllerAddress;
    private final StepCommandCodec codec;
    private final StepTimingPolicy timingPolicy;
    private final NavigationObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private final EndpointListener commandListener;
    private final EndpointListener acknowledgementListener;

    private volatile CountDownLatch ready = new CountDownLatch(2);

    public DatagramStepProtocolAdapter(DatagramEndpoint commandEndpoint,
                                       DatagramEndpoint acknowledgementEndpoint,
                                       SocketAddress controllerAddress,
                                       StepCommandCodec codec,
                                       StepTimingPolicy timingPolicy,
                                       NavigationObservabilitySink observabilitySink,
                                       MonotonicClock clock,
                                       WallClock wallClock)
    {
        this.commandEndpoint = Objects.requireNonNull(commandEndpoint, "commandEndpoint");
        this.acknowledgementEndpoint = Objects.requireNonNull(acknowledgementEndpoint, "acknowledgementEndpoint");
        this.controllerAddress = Objects.requireNonNull(controllerAddress, "controllerAddress");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.commandListener = new EndpointListener(COMMAND_ENDPOINT, false);
        this.acknowledgementListener = new EndpointListener(ACKNOWLEDGEMENT_ENDPOINT, true);
        this.commandEndpoint.setListener(commandListener);
        this.acknowledgementEndpoint.setListener(acknowledgementListener);
    }

    public DatagramStepProtocolAdapter(DatagramEndpoint commandEndpoint,
                                       DatagramEndpoint acknowledgementEndpoint,
                                       SocketAddress controllerAddress,
                                       StepTimingPolicy timingPolicy)
    {
        this(commandEndpoint, acknowledgementEndpoint, controllerAddress, new StepCommandCodec(), timingPolicy,
                null, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Starts both endpoints and blocks until both are up.
     *
     * @throws ControllerException if either endpoint fails to come up within
     *         {@link StepTimingPolicy#transportStartTimeout()}
     */
    public void start()
    {
        inbox.clear();
        ready = new CountDownLatch(2);

        acknowledgementEndpoint.start();
        commandEndpoint.start();

        Duration timeout = timingPolicy.transportStartTimeout();
        try {
            if (!ready.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new ControllerException(
                        "controller channel did not come up within " + timeout.toMillis() + " ms", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControllerException("interrupted while starting controller channel", e);
        }
        log.info("Controller channel ready, commands to {}", controllerAddress);
    }

    /**
     * Stops both endpoints. Safe to call more than once.
     */
    public void stop()
    {
        commandEndpoint.stop();
        acknowledgementEndpoint.stop();
    }

    @Override
    public void close()
    {
        stop();
    }

    public boolean isUp()
    {
        return commandListener.up && acknowledgementListener.up;
    }

    @Override
    public Acknowledgement sendAndAwait(Move move)
    {
        Objects.requireNonNull(move, "move");
        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("A step acknowledgement is already pending");
        }
        try {
            if (!isUp()) {
                throw fail(move, "controller channel is not up", null);
            }

            discardStale(move);

            byte[] payload = codec.encode(move);
            if (!commandEndpoint.send(controllerAddress, payload)) {
                throw fail(move, "command endpoint rejected send", null);
            }

            long startedNanos = clock.nowNanos();
            Inbound inbound = awaitInbound(move);
            Duration waited = Duration.ofNanos(clock.nowNanos() - startedNanos);

            if (inbound instanceof Inbound.Down down) {
                throw fail(move, down.endpoint() + " endpoint went down while awaiting acknowledgement", down.cause());
            }

            Inbound.Datagram datagram = (Inbound.Datagram) inbound;
            String text;
            try {
                text = codec.decodeAcknowledgement(datagram.payload());
            } catch (StepCodecException e) {
                throw fail(move, "malformed acknowledgement from " + datagram.remote() + ": " + e.getMessage(), e);
            }

            Acknowledgement ack = new Acknowledgement(move, text, waited);
            observabilitySink.onStepExchange(new StepExchangeEvent(wallClock.now(), move, text, waited));
            return ack;
        } finally {
            inFlight.set(false);
        }
    }

    private Inbound awaitInbound(Move move)
    {
        try {
            if (!timingPolicy.isAcknowledgementBounded()) {
                return inbox.take();
            }
            Duration timeout = timingPolicy.acknowledgementTimeout();
            Inbound inbound = inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (inbound == null) {
                throw fail(move, "no acknowledgement within " + timeout.toMillis() + " ms", null);
            }
            return inbound;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(move, "interrupted while awaiting acknowledgement", e);
        }
    }

    private void discardStale(Move move)
    {
        Inbound stale;
        while ((stale = inbox.poll()) != null) {
            if (stale instanceof Inbound.Down down && !isUp()) {
                throw fail(move, down.endpoint() + " endpoint is down", down.cause());
            }
            if (stale instanceof Inbound.Datagram datagram) {
                log.warn("Discarding unsolicited datagram ({} bytes) from {} before sending {}",
                        datagram.payload().length, datagram.remote(), move.token());
            }
        }
    }

    private ControllerException fail(Move move, String message, Throwable cause)
    {
        ControllerException e = cause == null
                ? new ControllerException(move, message)
                : new ControllerException(move, message, cause);
        // Reported to the sink by whoever ends the run on it.
        log.debug("Step exchange failed: {}", e.getMessage());
        return e;
    }

    /**
     * Items the transport threads hand to the planning thread.
     */
    private sealed interface Inbound permits Inbound.Datagram, Inbound.Down
    {
        record Datagram(SocketAddress remote, byte[] payload) implements Inbound {}

        record Down(String endpoint, Throwable cause) implements Inbound {}
    }

    private final class EndpointListener implements DatagramEndpointListener
    {
        private final String name;
        private final boolean acceptsAcknowledgements;

        private volatile boolean up;

        EndpointListener(String name, boolean acceptsAcknowledgements)
        {
            this.name = name;
            this.acceptsAcknowledgements = acceptsAcknowledgements;
        }

        @Override
        public void onTransportUp()
        {
            up = true;
            ready.countDown();
            observabilitySink.onTransportEvent(new StepTransportEvent(wallClock.now(), name, true, null));
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            boolean wasUp = up;
            up = false;
            if (wasUp) {
                inbox.offer(new Inbound.Down(name, cause));
            }
            observabilitySink.onTransportEvent(new StepTransportEvent(wallClock.now(), name, false, cause));
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            if (!acceptsAcknowledgements) {
                log.debug("Ignoring {} bytes received on {} endpoint from {}", payload.length, name, remote);
                return;
            }
            inbox.offer(new Inbound.Datagram(remote, payload));
        }
    }
}
