/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.internal.logging.InternalLogLevel;
import io.netty.util.internal.logging.InternalLogger;

import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;
import io.kafkawire.tag.VisibleForTesting;

/**
 * Logs the Kafka messages passing through a pipeline.
 * Requests and responses are summarised by their API and correlation id rather than dumped in full,
 * since their bodies can be arbitrarily large.
 */
public class FrameLoggingHandler extends LoggingHandler {
    private final InternalLogLevel frameLevel;
    private final InternalLogger frameLogger;

    public FrameLoggingHandler(String name, LogLevel frameLevel) {
        super(name);
        this.frameLevel = frameLevel.toInternalLevel();
        this.frameLogger = logger;
    }

    @VisibleForTesting
    FrameLoggingHandler(String name, LogLevel frameLevel, InternalLogger frameLogger) {
        super(name);
        this.frameLevel = frameLevel.toInternalLevel();
        this.frameLogger = frameLogger;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (frameLogger.isEnabled(frameLevel)) {
            frameLogger.log(frameLevel, format(ctx, "READ", summarise(msg)));
        }
        ctx.fireChannelRead(msg);
    }

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) throws Exception {
        if (frameLogger.isEnabled(frameLevel)) {
            frameLogger.log(frameLevel, format(ctx, "WRITE", summarise(msg)));
        }
        ctx.write(msg, promise);
    }

    @VisibleForTesting
    static Object summarise(Object msg) {
        if (msg instanceof Request request) {
            return request.apiKey() + " request (correlationId=" + request.correlationId() + ", clientId=" + request.clientId() + ")";
        }
        else if (msg instanceof Response response) {
            return response.getClass().getSimpleName() + " (correlationId=" + response.correlationId() + ")";
        }
        else if (msg instanceof ByteBuf buf) {
            return "frame of " + buf.readableBytes() + " byte(s)";
        }
        return msg;
    }
}
