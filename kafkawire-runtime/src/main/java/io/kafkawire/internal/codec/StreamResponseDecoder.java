/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.util.ReferenceCountUtil;

import io.kafkawire.protocol.FetchStream;
import io.kafkawire.protocol.FetchedMessage;
import io.kafkawire.protocol.PartitionStatus;
import io.kafkawire.protocol.Response;
import io.kafkawire.protocol.StreamFetchResponse;
import io.kafkawire.tag.RunsOnThread;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns the events of {@link FetchResponseSplitter} into responses.
 * <p>
 * A {@link FetchResponseEvent.Begin} is answered at once with a {@link StreamFetchResponse}, whose streams are then
 * fed the partition and message events that follow until the matching {@link FetchResponseEvent.End}.
 * A stream whose consumer has not yet taken the previous item refuses the next one: the event, and every event
 * after it, is then held back and the connection stops reading until the consumer catches up. The events held
 * back are at most those of one read.
 * Only one fetch response is streamed at a time, so events that do not fit that sequence are a
 * {@link StreamDesyncException}.
 * </p>
 * <p>
 * {@link BufferResponseFrame}s are decoded in full. Raw frames are passed on unchanged.
 * </p>
 */
public class StreamResponseDecoder extends KafkaMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamResponseDecoder.class);

    private record ActiveStream(int correlationId,
                                FetchStream<PartitionStatus> partitions,
                                FetchStream<FetchedMessage> messages,
                                CompletableFuture<Void> complete) {

        void fail(Throwable cause) {
            partitions.fail(cause);
            messages.fail(cause);
            complete.completeExceptionally(cause);
        }
    }

    private @Nullable ActiveStream active;
    // events waiting for a stream's consumer, oldest first
    private final Deque<Object> backlog = new ArrayDeque<>();
    private boolean paused;

    @Override
    protected Logger log() {
        return LOGGER;
    }

    @Override
    @RunsOnThread("event loop")
    protected DecodeOutcome decodeMessage(ChannelHandlerContext ctx, Object msg) {
        if (paused) {
            backlog.addLast(ReferenceCountUtil.retain(msg));
            return DecodeOutcome.consumed();
        }
        return handle(ctx, msg);
    }

    private DecodeOutcome handle(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof FetchResponseEvent.Begin begin) {
            return begin(ctx, begin);
        }
        else if (msg instanceof PartitionStatus status) {
            return active == null ? notStreaming(status) : feed(ctx, status, active.partitions());
        }
        else if (msg instanceof FetchedMessage message) {
            return active == null ? notStreaming(message) : feed(ctx, message, active.messages());
        }
        else if (msg instanceof FetchResponseEvent.End end) {
            return end(ctx, end);
        }
        else if (active != null) {
            return DecodeOutcome.failed(new StreamDesyncException("Received " + msg + " while streaming fetch response with correlation id "
                    + active.correlationId()));
        }
        else if (msg instanceof BufferResponseFrame frame) {
            return decodeBuffered(ctx, frame);
        }
        else {
            return DecodeOutcome.emit(msg);
        }
    }

    private DecodeOutcome begin(ChannelHandlerContext ctx, FetchResponseEvent.Begin begin) {
        if (active != null) {
            return DecodeOutcome.failed(new StreamDesyncException("Fetch response with correlation id " + begin.correlationId()
                    + " began while streaming fetch response with correlation id " + active.correlationId()));
        }
        ActiveStream stream = new ActiveStream(begin.correlationId(), new FetchStream<>(), new FetchStream<>(), new CompletableFuture<>());
        active = stream;
        LOGGER.debug("{}: Streaming fetch response with correlation id {}", ctx, begin.correlationId());
        return DecodeOutcome.emit(new StreamFetchResponse(stream.correlationId(), stream.partitions(), stream.messages(), stream.complete()));
    }

    private static DecodeOutcome notStreaming(Object event) {
        return DecodeOutcome.failed(new StreamDesyncException("Received " + event + " while no fetch response is being streamed"));
    }

    private <T> DecodeOutcome feed(ChannelHandlerContext ctx, T item, FetchStream<T> stream) {
        if (!stream.offer(item, () -> ctx.executor().execute(() -> resume(ctx)))) {
            backlog.addFirst(item);
            pause(ctx);
        }
        else if (LOGGER.isTraceEnabled() && stream.isDiscarded()) {
            LOGGER.trace("{}: Dropped {} from discarded stream", ctx, item);
        }
        return DecodeOutcome.consumed();
    }

    private void pause(ChannelHandlerContext ctx) {
        paused = true;
        ctx.channel().config().setAutoRead(false);
        LOGGER.debug("{}: Stream consumer is behind, stopped reading", ctx);
    }

    @RunsOnThread("event loop")
    private void resume(ChannelHandlerContext ctx) {
        if (!paused) {
            return;
        }
        paused = false;
        Object event;
        while (!paused && (event = backlog.pollFirst()) != null) {
            DecodeOutcome outcome = handle(ctx, event);
            if (outcome instanceof DecodeOutcome.Emit emit) {
                if (emit.message() != event) {
                    ReferenceCountUtil.release(event);
                }
                ctx.fireChannelRead(emit.message());
            }
            else if (outcome instanceof DecodeOutcome.Failed failed) {
                ReferenceCountUtil.release(event);
                releaseBacklog();
                LOGGER.error("{}: Error in decoder", ctx, failed.cause());
                ctx.fireExceptionCaught(failed.cause());
                return;
            }
            else if (!paused) {
                // a refused event went back to the head of the backlog
                ReferenceCountUtil.release(event);
            }
        }
        if (!paused) {
            LOGGER.debug("{}: Stream consumer caught up, reading again", ctx);
            ctx.channel().config().setAutoRead(true);
        }
    }

    private void releaseBacklog() {
        Object event;
        while ((event = backlog.pollFirst()) != null) {
            ReferenceCountUtil.release(event);
        }
    }

    private DecodeOutcome end(ChannelHandlerContext ctx, FetchResponseEvent.End end) {
        ActiveStream stream = active;
        if (stream == null || stream.correlationId() != end.correlationId()) {
            return DecodeOutcome.failed(new StreamDesyncException("Fetch response with correlation id " + end.correlationId()
                    + " ended while " + (stream == null ? "no fetch response is being streamed" : "streaming correlation id " + stream.correlationId())));
        }
        active = null;
        stream.partitions().close();
        stream.messages().close();
        stream.complete().complete(null);
        LOGGER.debug("{}: Completed fetch response with correlation id {}", ctx, end.correlationId());
        return DecodeOutcome.consumed();
    }

    private DecodeOutcome decodeBuffered(ChannelHandlerContext ctx, BufferResponseFrame frame) {
        try {
            ByteBuf body = frame.content();
            ByteBufAccessor accessor = new ByteBufAccessorImpl(body);
            Response response = ResponseBodyDecoder.decode(frame.apiKey(), frame.correlationId(), accessor);
            if (accessor.remaining() != 0) {
                return DecodeOutcome.failed(new KafkaCodecException(frame.apiKey() + " response with correlation id " + frame.correlationId()
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

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        paused = false;
        releaseBacklog();
        ActiveStream stream = active;
        if (stream != null) {
            active = null;
            LOGGER.warn("{}: Connection closed while streaming fetch response with correlation id {}", ctx, stream.correlationId());
            stream.fail(new KafkaCodecException("Connection closed before the end of fetch response with correlation id " + stream.correlationId()));
        }
        super.channelInactive(ctx);
    }
}
