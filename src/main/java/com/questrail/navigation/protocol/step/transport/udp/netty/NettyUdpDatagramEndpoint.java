package com.questrail.navigation.protocol.step.transport.udp.netty;

import com.questrail.navigation.protocol.step.transport.DatagramEndpoint;
import com.questrail.navigation.protocol.step.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT
 * interpret command tokens or acknowledgements, and it never waits, retries,
 * or times out.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket asynchronously; the listener learns
 *   the outcome through {@code onTransportUp}/{@code onTransportDown}.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 * Up/down notifications are de-duplicated per transition.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean up = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct a Netty UDP endpoint binding to the specified local address.
     *
     * <p>Each endpoint owns a single-threaded {@link NioEventLoopGroup}, which
     * serializes all listener callbacks.</p>
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                log.debug("UDP endpoint bound to {}", channel.localAddress());
                if (up.compareAndSet(false, true)) {
                    l.onTransportUp();
                }
            }
            else {
                log.debug("UDP endpoint failed to bind {}", bindAddress, future.cause());
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        group.shutdownGracefully();

        notifyDown(null);
    }

    @Override
    public boolean send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            // Transport not up. The caller decides how to handle this.
            return false;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ch.writeAndFlush(pkt).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("UDP send to {} failed", remote, future.cause());
            }
        });
        return true;
    }

    /**
     * Address the socket is actually bound to; useful when binding to port 0.
     * Empty until the endpoint is up.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((InetSocketAddress) ch.localAddress());
    }

    private void notifyDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (up.compareAndSet(true, false) && l != null) {
            l.onTransportDown(cause);
        }
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            SocketAddress remote = packet.sender();
            l.onDatagram(remote, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
