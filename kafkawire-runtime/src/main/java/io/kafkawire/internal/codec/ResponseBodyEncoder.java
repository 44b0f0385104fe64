/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import io.kafkawire.protocol.Broker;
import io.kafkawire.protocol.ConsumerMetadataResponse;
import io.kafkawire.protocol.ConsumerMetadataResult;
import io.kafkawire.protocol.FetchResponse;
import io.kafkawire.protocol.KafkaError;
import io.kafkawire.protocol.MetadataResponse;
import io.kafkawire.protocol.OffsetCommitResponse;
import io.kafkawire.protocol.OffsetFetchResponse;
import io.kafkawire.protocol.OffsetResponse;
import io.kafkawire.protocol.PartitionMetadata;
import io.kafkawire.protocol.ProduceResponse;
import io.kafkawire.protocol.Response;

/**
 * Encodes v0 responses, correlation id first.
 */
public final class ResponseBodyEncoder {

    static final int NO_LEADER = -1;

    private ResponseBodyEncoder() {
    }

    /**
     * Encode a response.
     * @param response the response
     * @param accessor destination
     * @throws KafkaCodecException if the response has no wire form
     */
    public static void encode(Response response, ByteBufAccessor accessor) {
        if (response instanceof ProduceResponse produce) {
            accessor.writeInt(produce.correlationId());
            accessor.writeTopicPartitions(produce.results(), (a, result) -> {
                writeError(a, result.error());
                a.writeLong(result.offset());
            });
        }
        else if (response instanceof FetchResponse fetch) {
            accessor.writeInt(fetch.correlationId());
            accessor.writeTopicPartitions(fetch.results(), (a, result) -> {
                writeError(a, result.error());
                a.writeLong(result.highwaterMarkOffset());
                a.writeMessageSet(result.messages());
            });
        }
        else if (response instanceof OffsetResponse offset) {
            accessor.writeInt(offset.correlationId());
            accessor.writeTopicPartitions(offset.results(), (a, result) -> {
                writeError(a, result.error());
                a.writeArray(result.offsets(), ByteBufAccessor::writeLong);
            });
        }
        else if (response instanceof MetadataResponse metadata) {
            writeMetadata(metadata, accessor);
        }
        else if (response instanceof OffsetCommitResponse offsetCommit) {
            accessor.writeInt(offsetCommit.correlationId());
            accessor.writeTopicPartitions(offsetCommit.results(), (a, result) -> writeError(a, result.error()));
        }
        else if (response instanceof OffsetFetchResponse offsetFetch) {
            accessor.writeInt(offsetFetch.correlationId());
            accessor.writeTopicPartitions(offsetFetch.results(), (a, result) -> {
                a.writeLong(result.offset());
                a.writeString(result.metadata());
                writeError(a, result.error());
            });
        }
        else if (response instanceof ConsumerMetadataResponse consumerMetadata) {
            accessor.writeInt(consumerMetadata.correlationId());
            ConsumerMetadataResult result = consumerMetadata.result();
            writeError(accessor, result.error());
            accessor.writeInt(result.coordinatorId());
            accessor.writeString(result.coordinatorHost());
            accessor.writeInt(result.coordinatorPort());
        }
        else {
            throw new KafkaCodecException(response.getClass().getSimpleName() + " has no wire form and cannot be encoded");
        }
    }

    private static void writeError(ByteBufAccessor accessor, KafkaError error) {
        accessor.writeShort(error.code());
    }

    private static void writeMetadata(MetadataResponse metadata, ByteBufAccessor accessor) {
        accessor.writeInt(metadata.correlationId());
        accessor.writeArray(metadata.brokers(), ResponseBodyEncoder::writeBroker);
        accessor.writeArray(metadata.topics(), (topicAccessor, topic) -> {
            writeError(topicAccessor, topic.error());
            topicAccessor.writeString(topic.name());
            topicAccessor.writeArray(topic.partitions(), ResponseBodyEncoder::writePartitionMetadata);
        });
    }

    private static void writeBroker(ByteBufAccessor accessor, Broker broker) {
        accessor.writeInt(broker.nodeId());
        accessor.writeString(broker.host());
        accessor.writeInt(broker.port());
    }

    private static void writePartitionMetadata(ByteBufAccessor accessor, PartitionMetadata partition) {
        writeError(accessor, partition.error());
        accessor.writeInt(partition.id());
        accessor.writeInt(partition.leader().map(Broker::nodeId).orElse(NO_LEADER));
        accessor.writeArray(partition.replicas(), (a, broker) -> a.writeInt(broker.nodeId()));
        accessor.writeArray(partition.isr(), (a, broker) -> a.writeInt(broker.nodeId()));
    }
}
