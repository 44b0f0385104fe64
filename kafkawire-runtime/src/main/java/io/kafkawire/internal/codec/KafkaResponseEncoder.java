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

import io.kafkawire.protocol.Response;

/**
 * Encodes {@link Response}s without a size prefix, which is added by a frame encoder further down the pipeline.
 * Responses without a wire form fail with {@link KafkaCodecException}.
 */
public class KafkaResponseEncoder extends MessageToByteEncoder<Response> {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaResponseEncoder.class);

    public KafkaResponseEncoder() {
        super(Response.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Response response, ByteBuf out) {
        LOGGER.trace("{}: Encoding {} to buffer {}", ctx, response, out);
        ResponseBodyEncoder.encode(response, new ByteBufAccessorImpl(out));
    }
}
