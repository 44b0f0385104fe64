/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

/**
 * Marks the boundaries of a fetch response split into events by {@link FetchResponseSplitter}.
 * Between a {@link Begin} and its {@link End} come the response's
 * {@link io.kafkawire.protocol.PartitionStatus PartitionStatus} and
 * {@link io.kafkawire.protocol.FetchedMessage FetchedMessage} events.
 */
public sealed interface FetchResponseEvent {

    int correlationId();

    record Begin(int correlationId) implements FetchResponseEvent {}

    record End(int correlationId) implements FetchResponseEvent {}
}
