/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;

import io.kafkawire.protocol.ApiKey;
import io.kafkawire.protocol.Request;

/**
 * Decodes whole request frames, as emitted by {@link KafkaFrameDecoder}, into {@link Request}s.
 * Frames this codec has no model for become {@link OpaqueRequestFrame}s.
 */
public class KafkaRequestDecoder extends KafkaMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaRequestDecoder.class);

    @Override
    protected Logger log() {
        return LOGGER;
    }

    @Override
    protected DecodeOutcome decodeMessage(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf frame)) {
            return DecodeOutcome.emit(msg);
        }
        try {
            ByteBufAccessor accessor = new ByteBufAccessorImpl(frame);
            short apiKeyId = accessor.readShort();
            short apiVersion = accessor.readShort();
            int correlationId = accessor.readInt();
            String clientId = accessor.readString();
            Optional<ApiKey> apiKey = ApiKey.forId(apiKeyId);
            if (apiKey.isEmpty() || !apiKey.get().hasResponseBody() || apiVersion != RequestBodyEncoder.API_VERSION) {
                int bodySize = accessor.remaining();
                frame.skipBytes(bodySize);
                LOGGER.debug("{}: Not decoding request with api key {} version {} correlation id {}", ctx, apiKeyId, apiVersion, correlationId);
                return DecodeOutcome.emit(new OpaqueRequestFrame(apiKeyId, apiVersion, correlationId, clientId, bodySize));
            }
            Request request = RequestBodyDecoder.decode(apiKey.get(), correlationId, clientId, accessor);
            if (accessor.remaining() != 0) {
                return DecodeOutcome.failed(new KafkaCodecException(apiKey.get() + " request with correlation id " + correlationId
                        + " has " + accessor.remaining() + " unread byte(s)"));
            }
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("{}: Decoded {}", ctx, request);
            }
            return DecodeOutcome.emit(request);
        }
        catch (KafkaCodecException e) {
            return DecodeOutcome.failed(e);
        }
    }
}
