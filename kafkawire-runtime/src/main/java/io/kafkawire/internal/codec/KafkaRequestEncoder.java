/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import io.kafkawire.protocol.Request;

/**
 * Encodes {@link Request}s without a size prefix, registering each request that expects a response
 * with the {@link CorrelationManager} the response decoder consults.
 */
public class KafkaRequestEncoder extends MessageToByteEncoder<Request> {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaRequestEncoder.class);

    private final CorrelationManager correlationManager;

    public KafkaRequestEncoder(CorrelationManager correlationManager) {
        super(Request.class);
        this.correlationManager = correlationManager;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Request request, ByteBuf out) {
        LOGGER.trace("{}: Encoding {} to buffer {}", ctx, request, out);
        RequestBodyEncoder.encode(request, new ByteBufAccessorImpl(out));
        if (request.expectsResponse()) {
            correlationManager.register(request.correlationId(), request.apiKey());
        }
        else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{}: {} request with correlation id {} expects no response", ctx, request.apiKey(), request.correlationId());
        }
    }
}
