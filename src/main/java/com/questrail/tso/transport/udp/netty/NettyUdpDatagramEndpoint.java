package com.questrail.tso.transport.udp.netty;

import com.questrail.tso.transport.DatagramEndpoint;
import com.questrail.tso.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * requests and never calls the allocation engine.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener on the channel's event loop. All reference-counted buffers are
 * released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket and begins receiving datagrams.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean up = new AtomicBoolean();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

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
                        ch.pipeline().addLast(new InboundHandler());
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
                up.set(true);
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        group.shutdownGracefully();
        markDown(null);
    }

    /**
     * Local address the socket is bound to, or {@code null} before the bind
     * completes. Useful when binding to port 0.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        return ch != null ? (InetSocketAddress) ch.localAddress() : null;
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            // Transport not up; the client times out and retries.
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    private void markDown(Throwable cause)
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
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes to the
     * port listener.
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

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            markDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            markDown(cause);
            ctx.close();
        }
    }
}
