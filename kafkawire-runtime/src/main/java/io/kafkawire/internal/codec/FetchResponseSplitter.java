/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import io.kafkawire.protocol.ApiKey;
import io.kafkawire.protocol.FetchedMessage;
import io.kafkawire.protocol.KafkaError;
import io.kafkawire.protocol.Message;
import io.kafkawire.protocol.MessageSet;
import io.kafkawire.protocol.PartitionStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Frames the inbound byte stream of a client connection, splitting fetch responses into events as their bytes arrive.
 * <p>
 * A fetch response becomes a {@link FetchResponseEvent.Begin}, then for each partition a {@link PartitionStatus}
 * followed by a {@link FetchedMessage} per complete message, and finally a {@link FetchResponseEvent.End}.
 * Only one message entry is buffered at a time. A message entry cut short at the end of a partition's
 * message set is skipped.
 * </p>
 * <p>
 * Any other response is buffered whole and emitted as a {@link BufferResponseFrame}. A response with an unknown
 * correlation id, or for an API without a response body, is emitted as the raw frame, correlation id included.
 * </p>
 */
public class FetchResponseSplitter extends ByteToMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FetchResponseSplitter.class);

    // frame size + correlation id
    private static final int FRAME_HEADER_LENGTH = 4 + 4;
    // partition + error code + highwater mark + message set size
    private static final int PARTITION_HEADER_LENGTH = 4 + 2 + 8 + 4;

    private enum State {
        FRAME_HEADER,
        BUFFERED_FRAME,
        TOPIC_COUNT,
        TOPIC_NAME,
        PARTITION_COUNT,
        PARTITION_HEADER,
        MESSAGE_ENTRY,
        SKIP_TRUNCATED_ENTRY
    }

    private final CorrelationManager correlationManager;
    private final int socketFrameMaxSize;

    private State state = State.FRAME_HEADER;
    private int correlationId;
    private @Nullable ApiKey bufferedApiKey;
    // bytes of the current frame not yet consumed
    private int frameRemaining;
    private int topicsRemaining;
    private @Nullable String topic;
    private int partitionsRemaining;
    private int partition;
    private int messageSetRemaining;

    public FetchResponseSplitter(CorrelationManager correlationManager, int socketFrameMaxSize) {
        this.correlationManager = correlationManager;
        this.socketFrameMaxSize = socketFrameMaxSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            boolean progress = true;
            while (progress) {
                progress = step(ctx, in, out);
            }
        }
        catch (KafkaCodecException e) {
            LOGGER.error("{}: Error in decoder", ctx, e);
            throw e;
        }
    }

    private boolean step(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        return switch (state) {
            case FRAME_HEADER -> readFrameHeader(ctx, in, out);
            case BUFFERED_FRAME -> readBufferedFrame(in, out);
            case TOPIC_COUNT -> readTopicCount(in, out);
            case TOPIC_NAME -> readTopicName(in);
            case PARTITION_COUNT -> readPartitionCount(in, out);
            case PARTITION_HEADER -> readPartitionHeader(in, out);
            case MESSAGE_ENTRY -> readMessageEntry(in, out);
            case SKIP_TRUNCATED_ENTRY -> skipTruncatedEntry(in, out);
        };
    }

    private boolean readFrameHeader(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < FRAME_HEADER_LENGTH) {
            return false;
        }
        int frameSize = in.getInt(in.readerIndex());
        if (frameSize < Integer.BYTES) {
            throw new KafkaCodecException("Frame size " + frameSize + " is too small for a response");
        }
        if (frameSize > socketFrameMaxSize) {
            throw new FrameOversizedException(socketFrameMaxSize, frameSize);
        }
        correlationId = in.getInt(in.readerIndex() + Integer.BYTES);
        Optional<ApiKey> apiKey = correlationManager.tryResolve(correlationId);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}: Frame of {} bytes for correlation id {} ({})", ctx, frameSize, correlationId, apiKey);
        }
        if (apiKey.isPresent() && apiKey.get() == ApiKey.FETCH) {
            in.skipBytes(FRAME_HEADER_LENGTH);
            frameRemaining = frameSize - Integer.BYTES;
            state = State.TOPIC_COUNT;
            out.add(new FetchResponseEvent.Begin(correlationId));
        }
        else {
            if (apiKey.isEmpty()) {
                LOGGER.warn("{}: Response with unknown correlation id {}, passing it on", ctx, correlationId);
            }
            in.skipBytes(Integer.BYTES);
            frameRemaining = frameSize;
            bufferedApiKey = apiKey.filter(ApiKey::hasResponseBody).orElse(null);
            state = State.BUFFERED_FRAME;
        }
        return true;
    }

    private boolean readBufferedFrame(ByteBuf in, List<Object> out) {
        if (in.readableBytes() < frameRemaining) {
            return false;
        }
        ByteBuf frame = in.readRetainedSlice(frameRemaining);
        if (bufferedApiKey != null) {
            frame.skipBytes(Integer.BYTES);
            out.add(new BufferResponseFrame(bufferedApiKey, correlationId, frame));
        }
        else {
            out.add(frame);
        }
        bufferedApiKey = null;
        frameRemaining = 0;
        state = State.FRAME_HEADER;
        return true;
    }

    private boolean readTopicCount(ByteBuf in, List<Object> out) {
        if (!available(in, Integer.BYTES)) {
            return false;
        }
        topicsRemaining = readInt(in);
        if (topicsRemaining < 0) {
            throw new KafkaCodecException("Illegal array length " + topicsRemaining);
        }
        if (topicsRemaining == 0) {
            endFrame(out);
        }
        else {
            state = State.TOPIC_NAME;
        }
        return true;
    }

    private boolean readTopicName(ByteBuf in) {
        if (!available(in, Short.BYTES)) {
            return false;
        }
        short length = in.getShort(in.readerIndex());
        if (length < -1) {
            throw new KafkaCodecException("Illegal string length " + length);
        }
        int fieldLength = Short.BYTES + Math.max(length, 0);
        if (!available(in, fieldLength)) {
            return false;
        }
        in.skipBytes(Short.BYTES);
        topic = length < 0 ? null : in.readCharSequence(length, StandardCharsets.UTF_8).toString();
        frameRemaining -= fieldLength;
        state = State.PARTITION_COUNT;
        return true;
    }

    private boolean readPartitionCount(ByteBuf in, List<Object> out) {
        if (!available(in, Integer.BYTES)) {
            return false;
        }
        partitionsRemaining = readInt(in);
        if (partitionsRemaining < 0) {
            throw new KafkaCodecException("Illegal array length " + partitionsRemaining);
        }
        if (partitionsRemaining == 0) {
            nextTopic(out);
        }
        else {
            state = State.PARTITION_HEADER;
        }
        return true;
    }

    private boolean readPartitionHeader(ByteBuf in, List<Object> out) {
        if (!available(in, PARTITION_HEADER_LENGTH)) {
            return false;
        }
        partition = in.readInt();
        KafkaError error = KafkaError.forCode(in.readShort());
        long highwaterMarkOffset = in.readLong();
        int messageSetSize = in.readInt();
        frameRemaining -= PARTITION_HEADER_LENGTH;
        if (messageSetSize < 0 || messageSetSize > frameRemaining) {
            throw new KafkaCodecException("Message set size " + messageSetSize + " of " + topic + "-" + partition
                    + " does not fit the " + frameRemaining + " byte(s) remaining in the frame");
        }
        messageSetRemaining = messageSetSize;
        out.add(new PartitionStatus(topic, partition, error, highwaterMarkOffset));
        if (messageSetRemaining == 0) {
            nextPartition(out);
        }
        else {
            state = State.MESSAGE_ENTRY;
        }
        return true;
    }

    private boolean readMessageEntry(ByteBuf in, List<Object> out) {
        if (messageSetRemaining < MessageSet.LOG_OVERHEAD) {
            state = State.SKIP_TRUNCATED_ENTRY;
            return true;
        }
        if (in.readableBytes() < MessageSet.LOG_OVERHEAD) {
            return false;
        }
        int messageSize = in.getInt(in.readerIndex() + Long.BYTES);
        if (messageSize < 0) {
            throw new KafkaCodecException("Negative message size " + messageSize + " in " + topic + "-" + partition);
        }
        if ((long) MessageSet.LOG_OVERHEAD + messageSize > messageSetRemaining) {
            state = State.SKIP_TRUNCATED_ENTRY;
            return true;
        }
        int entrySize = MessageSet.LOG_OVERHEAD + messageSize;
        if (in.readableBytes() < entrySize) {
            return false;
        }
        long offset = in.readLong();
        in.skipBytes(Integer.BYTES);
        Message message;
        try {
            message = Message.readFrom(in.nioBuffer(in.readerIndex(), messageSize));
        }
        catch (IllegalArgumentException e) {
            throw new KafkaCodecException("Malformed message at offset " + offset + " of " + topic + "-" + partition, e);
        }
        in.skipBytes(messageSize);
        frameRemaining -= entrySize;
        messageSetRemaining -= entrySize;
        out.add(new FetchedMessage(topic, partition, offset, message));
        if (messageSetRemaining == 0) {
            nextPartition(out);
        }
        return true;
    }

    private boolean skipTruncatedEntry(ByteBuf in, List<Object> out) {
        if (!in.isReadable()) {
            return false;
        }
        int skipped = Math.min(in.readableBytes(), messageSetRemaining);
        in.skipBytes(skipped);
        frameRemaining -= skipped;
        messageSetRemaining -= skipped;
        if (messageSetRemaining == 0) {
            nextPartition(out);
        }
        return true;
    }

    private void nextPartition(List<Object> out) {
        if (--partitionsRemaining > 0) {
            state = State.PARTITION_HEADER;
        }
        else {
            nextTopic(out);
        }
    }

    private void nextTopic(List<Object> out) {
        if (--topicsRemaining > 0) {
            state = State.TOPIC_NAME;
        }
        else {
            endFrame(out);
        }
    }

    private void endFrame(List<Object> out) {
        if (frameRemaining != 0) {
            throw new KafkaCodecException("Fetch response with correlation id " + correlationId + " has " + frameRemaining + " unread byte(s)");
        }
        out.add(new FetchResponseEvent.End(correlationId));
        topic = null;
        state = State.FRAME_HEADER;
    }

    private int readInt(ByteBuf in) {
        frameRemaining -= Integer.BYTES;
        return in.readInt();
    }

    private boolean available(ByteBuf in, int length) {
        if (length > frameRemaining) {
            throw new KafkaCodecException("Fetch response with correlation id " + correlationId + " needs " + length
                    + " more byte(s) but only " + frameRemaining + " remain in the frame");
        }
        return in.readableBytes() >= length;
    }
}
