/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

/**
 * Splits the inbound byte stream into frames using the int32 size that precedes each of them.
 * Each frame is emitted as a buffer without its size field.
 */
public class KafkaFrameDecoder extends ByteToMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaFrameDecoder.class);

    public static final int FRAME_SIZE_LENGTH = Integer.BYTES;

    private final int socketFrameMaxSize;

    public KafkaFrameDecoder(int socketFrameMaxSize) {
        this.socketFrameMaxSize = socketFrameMaxSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= FRAME_SIZE_LENGTH) {
            try {
                int sof = in.readerIndex();
                int frameSize = in.readInt();
                if (frameSize < 0) {
                    throw new KafkaCodecException("Negative frame size " + frameSize);
                }
                if (frameSize > socketFrameMaxSize) {
                    throw new FrameOversizedException(socketFrameMaxSize, frameSize);
                }
                int readable = in.readableBytes();
                if (LOGGER.isTraceEnabled()) { // avoid boxing
                    LOGGER.trace("{}: Frame of {} bytes ({} readable)", ctx, frameSize, readable);
                }
                if (readable >= frameSize) { // We can read the whole frame
                    out.add(in.readRetainedSlice(frameSize));
                }
                else {
                    in.readerIndex(sof);
                    break;
                }
            }
            catch (KafkaCodecException e) {
                LOGGER.error("{}: Error in decoder", ctx, e);
                throw e;
            }
        }
    }
}
