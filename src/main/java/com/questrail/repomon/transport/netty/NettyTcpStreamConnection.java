package com.questrail.repomon.transport.netty;

import com.questrail.repomon.transport.StreamConnection;
import com.questrail.repomon.transport.StreamConnectionListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamConnection
 * =============================================================================
 * {@link StreamConnection} over a Netty {@link NioSocketChannel}.
 *
 * <p>No frame decoder is installed in the pipeline: every {@code channelRead}
 * is handed to the listener as one byte array, which the stream transport
 * treats as one frame. Reads use a fixed buffer of {@code receiveBufferSize}
 * bytes so that a frame written in one piece is not split by an adaptive
 * buffer that has shrunk after a run of small reads.</p>
 *
 * <p>Same containment rule as {@link NettyUdpDatagramEndpoint}: no Netty type
 * leaves this package.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect()} connects asynchronously; there is no connect timeout.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
public final class NettyTcpStreamConnection implements StreamConnection
{
    private final InetSocketAddress remoteAddress;
    private final int receiveBufferSize;
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile StreamConnectionListener listener;
    private volatile Channel channel;

    public NettyTcpStreamConnection(InetSocketAddress remoteAddress, int receiveBufferSize)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be positive");
        }
        this.receiveBufferSize = receiveBufferSize;
    }

    @Override
    public void setListener(StreamConnectionListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        if (listener == null) {
            throw new IllegalStateException("StreamConnectionListener must be set before connect()");
        }

        new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(receiveBufferSize))
                .handler(new ReadHandler())
                .connect(remoteAddress)
                .addListener((ChannelFutureListener) this::onConnectComplete);
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public CompletableFuture<Void> write(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        return NettyFutures.toCompletable(ch.writeAndFlush(Unpooled.wrappedBuffer(frame)));
    }

    private void onConnectComplete(ChannelFuture connected)
    {
        if (!connected.isSuccess()) {
            group.shutdownGracefully();
            notifyDown(connected.cause());
            return;
        }
        channel = connected.channel();
        listener.onConnected();
    }

    private void notifyDown(Throwable cause)
    {
        StreamConnectionListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onDisconnected(cause);
        }
    }

    private final class ReadHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            listener.onBytes(ByteBufUtil.getBytes(content));
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
