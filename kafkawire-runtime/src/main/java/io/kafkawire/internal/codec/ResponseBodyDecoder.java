/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.kafkawire.protocol.ApiKey;
import io.kafkawire.protocol.Broker;
import io.kafkawire.protocol.ConsumerMetadataResponse;
import io.kafkawire.protocol.ConsumerMetadataResult;
import io.kafkawire.protocol.FetchResponse;
import io.kafkawire.protocol.FetchResult;
import io.kafkawire.protocol.KafkaError;
import io.kafkawire.protocol.MetadataResponse;
import io.kafkawire.protocol.OffsetCommitResponse;
import io.kafkawire.protocol.OffsetCommitResult;
import io.kafkawire.protocol.OffsetFetchResponse;
import io.kafkawire.protocol.OffsetFetchResult;
import io.kafkawire.protocol.OffsetResponse;
import io.kafkawire.protocol.OffsetResult;
import io.kafkawire.protocol.PartitionMetadata;
import io.kafkawire.protocol.ProduceResponse;
import io.kafkawire.protocol.ProduceResult;
import io.kafkawire.protocol.Response;
import io.kafkawire.protocol.TopicMetadata;

/**
 * Decodes the v0 response bodies, that is everything after the correlation id.
 */
public final class ResponseBodyDecoder {

    private ResponseBodyDecoder() {
    }

    /**
     * Decode a response body.
     * @param apiKey the API of the request being answered, which must have a response body
     * @param correlationId the correlation id already read from the response
     * @param accessor the body
     * @return the response
     * @throws KafkaCodecException if the body is malformed
     */
    public static Response decode(ApiKey apiKey, int correlationId, ByteBufAccessor accessor) {
        return switch (apiKey) {
            case PRODUCE -> new ProduceResponse(correlationId, accessor.readTopicPartitions(ResponseBodyDecoder::readProduceResult));
            case FETCH -> new FetchResponse(correlationId, accessor.readTopicPartitions(ResponseBodyDecoder::readFetchResult));
            case OFFSET -> new OffsetResponse(correlationId, accessor.readTopicPartitions(ResponseBodyDecoder::readOffsetResult));
            case METADATA -> readMetadataResponse(correlationId, accessor);
            case OFFSET_COMMIT -> new OffsetCommitResponse(correlationId, accessor.readTopicPartitions(ResponseBodyDecoder::readOffsetCommitResult));
            case OFFSET_FETCH -> new OffsetFetchResponse(correlationId, accessor.readTopicPartitions(ResponseBodyDecoder::readOffsetFetchResult));
            case CONSUMER_METADATA -> new ConsumerMetadataResponse(correlationId, readConsumerMetadataResult(accessor));
            case LEADER_AND_ISR, STOP_REPLICA -> throw new KafkaCodecException("No response body is defined for " + apiKey);
        };
    }

    private static KafkaError readError(ByteBufAccessor accessor) {
        return KafkaError.forCode(accessor.readShort());
    }

    private static ProduceResult readProduceResult(ByteBufAccessor accessor) {
        KafkaError error = readError(accessor);
        long offset = accessor.readLong();
        return new ProduceResult(error, offset);
    }

    private static FetchResult readFetchResult(ByteBufAccessor accessor) {
        KafkaError error = readError(accessor);
        long highwaterMarkOffset = accessor.readLong();
        return new FetchResult(error, highwaterMarkOffset, accessor.readMessageSet());
    }

    private static OffsetResult readOffsetResult(ByteBufAccessor accessor) {
        KafkaError error = readError(accessor);
        List<Long> offsets = accessor.readArray(ByteBufAccessor::readLong);
        return new OffsetResult(error, offsets);
    }

    private static OffsetCommitResult readOffsetCommitResult(ByteBufAccessor accessor) {
        return new OffsetCommitResult(readError(accessor));
    }

    private static OffsetFetchResult readOffsetFetchResult(ByteBufAccessor accessor) {
        long offset = accessor.readLong();
        String metadata = accessor.readString();
        return new OffsetFetchResult(offset, metadata, readError(accessor));
    }

    private static ConsumerMetadataResult readConsumerMetadataResult(ByteBufAccessor accessor) {
        KafkaError error = readError(accessor);
        int coordinatorId = accessor.readInt();
        String host = accessor.readString();
        int port = accessor.readInt();
        return new ConsumerMetadataResult(error, coordinatorId, host, port);
    }

    private static MetadataResponse readMetadataResponse(int correlationId, ByteBufAccessor accessor) {
        List<Broker> brokers = accessor.readArray(ResponseBodyDecoder::readBroker);
        Map<Integer, Broker> brokersById = new HashMap<>();
        for (Broker broker : brokers) {
            brokersById.put(broker.nodeId(), broker);
        }
        List<TopicMetadata> topics = accessor.readArray(topicAccessor -> {
            KafkaError error = readError(topicAccessor);
            String name = topicAccessor.readString();
            List<PartitionMetadata> partitions = topicAccessor.readArray(partitionAccessor -> readPartitionMetadata(partitionAccessor, brokersById));
            return new TopicMetadata(error, name, partitions);
        });
        return new MetadataResponse(correlationId, brokers, topics);
    }

    private static Broker readBroker(ByteBufAccessor accessor) {
        int nodeId = accessor.readInt();
        String host = accessor.readString();
        int port = accessor.readInt();
        return new Broker(nodeId, host, port);
    }

    private static PartitionMetadata readPartitionMetadata(ByteBufAccessor accessor, Map<Integer, Broker> brokersById) {
        KafkaError error = readError(accessor);
        int id = accessor.readInt();
        // -1 while a leader is being elected
        Optional<Broker> leader = Optional.ofNullable(brokersById.get(accessor.readInt()));
        List<Broker> replicas = accessor.readArray(a -> knownBroker(a.readInt(), brokersById, "replica"));
        List<Broker> isr = accessor.readArray(a -> knownBroker(a.readInt(), brokersById, "isr"));
        return new PartitionMetadata(error, id, leader, replicas, isr);
    }

    private static Broker knownBroker(int nodeId, Map<Integer, Broker> brokersById, String role) {
        Broker broker = brokersById.get(nodeId);
        if (broker == null) {
            throw new KafkaCodecException("Partition " + role + " references node id " + nodeId + " which is not in the broker list");
        }
        return broker;
    }
}
