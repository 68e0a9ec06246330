package com.questrail.repomon.transport.netty;

import com.questrail.repomon.transport.DatagramEndpoint;
import com.questrail.repomon.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * {@link DatagramEndpoint} over a Netty {@link NioDatagramChannel}.
 *
 * <p>The endpoint moves bytes and nothing else. Every datagram, from any
 * sender, is copied out of its {@code ByteBuf} and handed to the listener;
 * sender filtering and decoding belong to
 * {@link com.questrail.repomon.transport.DatagramTransport}. Sends are never
 * retried or queued beyond what the channel itself does.</p>
 *
 * <h2>Netty containment rule</h2>
 * Channels, event loops and buffers stay inside this package. Callers see
 * {@code byte[]}, {@link SocketAddress} and {@link CompletableFuture} only.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start() ─bind ok──▶ onTransportUp(local) ─ ... ─ stop() / socket error ─▶ onTransportDown
 *          └bind fail─▶ onTransportDown(cause)
 * </pre>
 * <h2>Receive buffer</h2>
 * Reads go into a fixed buffer of {@code receiveBufferSize} bytes. A datagram
 * longer than that is truncated by the socket, so the size must cover the
 * largest frame the peer may send.
 *
 * <p>{@code onTransportDown} is delivered at most once. The event loop group is
 * single-threaded and owned by this endpoint; it is shut down on stop or on a
 * failed bind.</p>
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;
    private final int receiveBufferSize;
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * @param bindAddress local address to bind; port 0 picks an ephemeral port
     * @param receiveBufferSize largest datagram delivered intact
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int receiveBufferSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be positive");
        }
        this.receiveBufferSize = receiveBufferSize;
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }

        new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(receiveBufferSize))
                .handler(new DatagramHandler())
                .bind(bindAddress)
                .addListener((ChannelFutureListener) this::onBindComplete);
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public CompletableFuture<Void> send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        DatagramPacket packet = new DatagramPacket(Unpooled.wrappedBuffer(payload), (InetSocketAddress) remote);
        return NettyFutures.toCompletable(ch.writeAndFlush(packet));
    }

    private void onBindComplete(ChannelFuture bound)
    {
        if (!bound.isSuccess()) {
            group.shutdownGracefully();
            notifyDown(bound.cause());
            return;
        }
        channel = bound.channel();
        listener.onTransportUp(bound.channel().localAddress());
    }

    private void notifyDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * Copies each inbound payload and reports channel loss. Runs on the
     * endpoint's event loop, which serializes all listener callbacks.
     */
    private final class DatagramHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            listener.onDatagram(packet.sender(), ByteBufUtil.getBytes(packet.content()));
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
