package com.pantheon.dispatch.monitor.transport.udp.netty;

import com.pantheon.dispatch.monitor.transport.DatagramEndpoint;
import com.pantheon.dispatch.monitor.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed {@link DatagramEndpoint} on which tag reports from the reader
 * arrive.
 *
 * <p>Pure transport: it does not decode reports or know about tags. Inbound
 * payloads are copied into {@code byte[]} before they reach the listener and
 * every reference-counted buffer is released here. Netty types do not leave
 * this package.</p>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the socket asynchronously. {@link #stop()} closes the
 * channel and shuts the event loop group down; an endpoint is not restartable.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

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

        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    /**
     * Local address the socket is bound to, once started. Useful when binding
     * to an ephemeral port.
     */
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : ch.localAddress();
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

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
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
