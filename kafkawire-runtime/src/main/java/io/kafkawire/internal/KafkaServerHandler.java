/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import io.kafkawire.internal.codec.OpaqueRequestFrame;
import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;
import io.kafkawire.server.RejectedRequestException;
import io.kafkawire.server.RequestHandler;
import io.kafkawire.tag.RunsOnThread;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Services the requests of one server connection strictly one at a time, in arrival order.
 * <p>
 * Each request is passed to the connection's {@link RequestHandler}, and the next request is not dispatched
 * until the handler's response has been written. A {@link NilResponse} is not written at all.
 * An inbound value that is not a {@link Request} is reported to {@link RequestHandler#rejected} without
 * disturbing the connection, whereas a handler that fails, or a response that cannot be written, leaves the
 * client unable to match later responses, so the connection is closed.
 * </p>
 */
public class KafkaServerHandler extends ChannelInboundHandlerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaServerHandler.class);

    private final RequestHandler requestHandler;

    // Read/Mutated by the Netty thread only.
    private final Deque<Object> pending = new ArrayDeque<>();
    private @Nullable CompletableFuture<Response> inFlight;
    private boolean writing;
    private boolean closed;

    public KafkaServerHandler(RequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    @Override
    @RunsOnThread("event loop")
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (closed) {
            ReferenceCountUtil.release(msg);
            return;
        }
        pending.addLast(msg);
        dispatchNext(ctx);
    }

    @RunsOnThread("event loop")
    private void dispatchNext(ChannelHandlerContext ctx) {
        Object msg;
        while (inFlight == null && !writing && !closed && (msg = pending.pollFirst()) != null) {
            if (msg instanceof Request request) {
                dispatch(ctx, request);
            }
            else {
                RejectedRequestException failure = rejection(msg);
                ReferenceCountUtil.release(msg);
                LOGGER.warn("{}: {}", ctx, failure.getMessage());
                try {
                    requestHandler.rejected(failure);
                }
                catch (RuntimeException e) {
                    LOGGER.error("{}: Handler failed on rejected request, closing connection", ctx, e);
                    ctx.close();
                }
            }
        }
    }

    private static RejectedRequestException rejection(Object msg) {
        if (msg instanceof OpaqueRequestFrame frame) {
            return new RejectedRequestException("Request with api key " + frame.apiKey() + " version " + frame.apiVersion()
                    + " correlation id " + frame.correlationId() + " is not supported", OptionalInt.of(frame.correlationId()));
        }
        return new RejectedRequestException("Invalid message " + msg + ", not dispatched", OptionalInt.empty());
    }

    private void dispatch(ChannelHandlerContext ctx, Request request) {
        CompletableFuture<Response> future;
        try {
            future = requestHandler.handle(request).toCompletableFuture();
        }
        catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        inFlight = future;
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}: Dispatched {} request with correlation id {}", ctx, request.apiKey(), request.correlationId());
        }
        CompletableFuture<Response> dispatched = future;
        future.whenComplete((response, error) -> ctx.executor().execute(() -> onComplete(ctx, request, dispatched, response, error)));
    }

    @RunsOnThread("event loop")
    private void onComplete(ChannelHandlerContext ctx, Request request, CompletableFuture<Response> dispatched,
                            @Nullable Response response, @Nullable Throwable error) {
        if (inFlight != dispatched || closed) {
            return;
        }
        inFlight = null;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (!(cause instanceof CancellationException)) {
                LOGGER.error("{}: Handler failed {} request with correlation id {}, closing connection", ctx, request.apiKey(), request.correlationId(), cause);
            }
            ctx.close();
            return;
        }
        if (response == null || response instanceof NilResponse) {
            LOGGER.debug("{}: No response to {} request with correlation id {}", ctx, request.apiKey(), request.correlationId());
        }
        else {
            if (response.correlationId() != request.correlationId()) {
                LOGGER.warn("{}: Response correlation id {} does not match request correlation id {}", ctx, response.correlationId(), request.correlationId());
            }
            writing = true;
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE).addListener(written -> {
                writing = false;
                if (written.isSuccess()) {
                    dispatchNext(ctx);
                }
            });
            return;
        }
        dispatchNext(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: Kafka server received unexpected exception, closing connection.", ctx, cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        closed = true;
        Object msg;
        while ((msg = pending.pollFirst()) != null) {
            ReferenceCountUtil.release(msg);
        }
        CompletableFuture<Response> future = inFlight;
        inFlight = null;
        if (future != null) {
            future.cancel(false);
        }
        try {
            requestHandler.close();
        }
        catch (RuntimeException e) {
            LOGGER.warn("{}: Error closing request handler", ctx, e);
        }
        super.channelInactive(ctx);
    }
}
