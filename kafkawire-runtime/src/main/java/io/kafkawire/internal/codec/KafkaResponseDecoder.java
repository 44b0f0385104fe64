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
import io.kafkawire.protocol.Response;

/**
 * Decodes whole response frames, as emitted by {@link KafkaFrameDecoder}, into {@link Response}s.
 * <p>
 * The API of each response is looked up by its correlation id in the {@link CorrelationManager}.
 * A frame whose correlation id is unknown, or whose API has no response body, is passed on unchanged
 * for a later handler to deal with.
 * </p>
 */
public class KafkaResponseDecoder extends KafkaMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaResponseDecoder.class);

    private final CorrelationManager correlationManager;

    public KafkaResponseDecoder(CorrelationManager correlationManager) {
        this.correlationManager = correlationManager;
    }

    @Override
    protected Logger log() {
        return LOGGER;
    }

    @Override
    protected DecodeOutcome decodeMessage(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf frame)) {
            return DecodeOutcome.emit(msg);
        }
        int start = frame.readerIndex();
        try {
            ByteBufAccessor accessor = new ByteBufAccessorImpl(frame);
            int correlationId = accessor.readInt();
            Optional<ApiKey> apiKey = correlationManager.tryResolve(correlationId);
            if (apiKey.isEmpty()) {
                LOGGER.warn("{}: Response with unknown correlation id {}, passing it on", ctx, correlationId);
                frame.readerIndex(start);
                return DecodeOutcome.emit(frame);
            }
            if (!apiKey.get().hasResponseBody()) {
                LOGGER.debug("{}: {} response with correlation id {} is not decoded", ctx, apiKey.get(), correlationId);
                frame.readerIndex(start);
                return DecodeOutcome.emit(frame);
            }
            Response response = ResponseBodyDecoder.decode(apiKey.get(), correlationId, accessor);
            if (accessor.remaining() != 0) {
                return DecodeOutcome.failed(new KafkaCodecException(apiKey.get() + " response with correlation id " + correlationId
                        + " has " + accessor.remaining() + " unread byte(s)"));
            }
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("{}: Decoded {}", ctx, response);
            }
            return DecodeOutcome.emit(response);
        }
        catch (KafkaCodecException e) {
            return DecodeOutcome.failed(e);
        }
    }
}
