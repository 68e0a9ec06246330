package com.questrail.repomon.transport.netty;

import io.netty.channel.ChannelFuture;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges Netty completion to {@link CompletableFuture} so that no Netty type
 * crosses the transport port boundary.
 */
final class NettyFutures
{
    private NettyFutures() {}

    static CompletableFuture<Void> toCompletable(ChannelFuture future)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        future.addListener(f -> {
            if (f.isSuccess()) {
                result.complete(null);
            }
            else if (f.isCancelled()) {
                result.cancel(false);
            }
            else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }
}
