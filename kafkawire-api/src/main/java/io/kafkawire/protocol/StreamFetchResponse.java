/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A fetch response delivered as soon as its header has arrived. The body follows as two streams fed by the
 * connection's read path: one {@link PartitionStatus} per partition and one {@link FetchedMessage} per message.
 * <p>
 * The read path hands each item over one at a time, so both streams must be consumed, concurrently and off the
 * connection's event loop, or {@link #discard() discarded}. {@link #complete()} completes once the whole body has
 * been read, and completes exceptionally if the connection fails first.
 * </p>
 */
public final class StreamFetchResponse implements Response {

    private final int correlationId;
    private final FetchStream<PartitionStatus> partitions;
    private final FetchStream<FetchedMessage> messages;
    private final CompletableFuture<Void> complete;

    public StreamFetchResponse(int correlationId,
                               FetchStream<PartitionStatus> partitions,
                               FetchStream<FetchedMessage> messages,
                               CompletableFuture<Void> complete) {
        this.correlationId = correlationId;
        this.partitions = Objects.requireNonNull(partitions);
        this.messages = Objects.requireNonNull(messages);
        this.complete = Objects.requireNonNull(complete);
    }

    @Override
    public int correlationId() {
        return correlationId;
    }

    public FetchStream<PartitionStatus> partitions() {
        return partitions;
    }

    public FetchStream<FetchedMessage> messages() {
        return messages;
    }

    public CompletionStage<Void> complete() {
        return complete.minimalCompletionStage();
    }

    /**
     * Abandon both streams. The connection still reads the rest of the body, dropping it.
     */
    public void discard() {
        partitions.discard();
        messages.discard();
    }

    @Override
    public String toString() {
        return "StreamFetchResponse(correlationId=" + correlationId + ", complete=" + complete.isDone() + ')';
    }
}
