/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal;

import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import io.kafkawire.internal.codec.KafkaCodecException;
import io.kafkawire.internal.codec.UnknownCorrelationIdException;
import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;
import io.kafkawire.tag.RunsOnThread;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Matches the responses decoded on a pipelined client connection to the requests that were sent, in order.
 * <p>
 * A response that is not for the oldest outstanding request, or a frame that could not be decoded,
 * means the connection has lost track of the protocol: every outstanding request fails and the connection is closed.
 * </p>
 */
public class KafkaClientHandler extends ChannelInboundHandlerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaClientHandler.class);

    private record PendingRequest(Request request, CompletableFuture<Response> responseFuture) {}

    private final Deque<PendingRequest> queue = new ConcurrentLinkedDeque<>();
    private @Nullable ChannelHandlerContext ctx;

    // Read/Mutated by the Netty thread only.
    private final Deque<PendingRequest> awaitingResponse = new ArrayDeque<>();
    private boolean channelActivationSeen;
    private @Nullable Throwable closedCause;

    @Override
    public void channelRegistered(ChannelHandlerContext ctx) {
        this.ctx = ctx;
        ctx.fireChannelRegistered();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        this.channelActivationSeen = true;
        processPendingWrites();
        ctx.fireChannelActive();
    }

    @Override
    @RunsOnThread("event loop")
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof Response response) {
            PendingRequest expected = awaitingResponse.pollFirst();
            if (expected == null) {
                fatal(ctx, new KafkaCodecException("Received response with correlation id " + response.correlationId() + " with no request outstanding"));
            }
            else if (expected.request().correlationId() != response.correlationId()) {
                expected.responseFuture().completeExceptionally(new UnknownCorrelationIdException(response.correlationId()));
                fatal(ctx, new KafkaCodecException("Received response with correlation id " + response.correlationId()
                        + " while expecting correlation id " + expected.request().correlationId()));
            }
            else {
                expected.responseFuture().complete(response);
            }
        }
        else {
            KafkaCodecException cause = undecoded(msg);
            ReferenceCountUtil.release(msg);
            fatal(ctx, cause);
        }
    }

    private static KafkaCodecException undecoded(Object msg) {
        if (msg instanceof ByteBuf frame && frame.readableBytes() >= Integer.BYTES) {
            return new UnknownCorrelationIdException(frame.getInt(frame.readerIndex()));
        }
        return new KafkaCodecException("Received " + msg + " which is not a response");
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        ctx.flush();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Kafka client received unexpected exception, closing connection.", cause);
        failAll(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        failAll(new ClosedChannelException());
        super.channelInactive(ctx);
    }

    /**
     * Sends a request.  If the channel is not yet active, the request is queued up until it
     * is.
     * <br/>
     * The response to the request is returned by the future. If the request has no response the
     * future will complete once the request is sent and yield a {@link NilResponse}.
     *
     * @param request request to send
     * @return future that will yield the response.
     */
    public CompletableFuture<Response> sendRequest(Request request) {
        var pending = new PendingRequest(request, new CompletableFuture<>());
        queue.addLast(pending);
        processPendingWrites();
        return pending.responseFuture();
    }

    /**
     * @return the number of requests sent and awaiting a response, read on the event loop.
     */
    @RunsOnThread("event loop")
    int awaitingResponseCount() {
        return awaitingResponse.size();
    }

    private void processPendingWrites() {
        ChannelHandlerContext context = this.ctx;
        if (context == null) {
            return;
        }
        context.executor().execute(() -> {
            if (closedCause != null) {
                failQueued(closedCause);
                return;
            }
            if (!channelActivationSeen) {
                return;
            }

            PendingRequest pending;
            while ((pending = queue.pollFirst()) != null) {
                var msg = pending;
                boolean hasResponse = msg.request().expectsResponse();
                if (hasResponse) {
                    awaitingResponse.addLast(msg);
                }
                context.writeAndFlush(msg.request()).addListener(c -> {
                    if (c.cause() != null) {
                        // encoding or I/O failed
                        awaitingResponse.remove(msg);
                        msg.responseFuture().completeExceptionally(c.cause());
                    }
                    else if (!hasResponse) {
                        msg.responseFuture().complete(new NilResponse(msg.request().correlationId()));
                    }
                });
            }
        });
    }

    private void fatal(ChannelHandlerContext ctx, KafkaCodecException cause) {
        LOGGER.warn("{}: {}, closing connection.", ctx, cause.getMessage());
        failAll(cause);
        ctx.close();
    }

    private void failAll(Throwable cause) {
        if (closedCause == null) {
            closedCause = cause;
        }
        PendingRequest pending;
        while ((pending = awaitingResponse.pollFirst()) != null) {
            pending.responseFuture().completeExceptionally(cause);
        }
        failQueued(cause);
    }

    private void failQueued(Throwable cause) {
        PendingRequest pending;
        while ((pending = queue.pollFirst()) != null) {
            pending.responseFuture().completeExceptionally(cause);
        }
    }
}
