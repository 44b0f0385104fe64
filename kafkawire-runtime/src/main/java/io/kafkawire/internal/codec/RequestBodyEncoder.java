/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import io.kafkawire.protocol.ConsumerMetadataRequest;
import io.kafkawire.protocol.FetchRequest;
import io.kafkawire.protocol.MetadataRequest;
import io.kafkawire.protocol.OffsetCommitRequest;
import io.kafkawire.protocol.OffsetFetchRequest;
import io.kafkawire.protocol.OffsetRequest;
import io.kafkawire.protocol.ProduceRequest;
import io.kafkawire.protocol.Request;

/**
 * Encodes v0 requests, header first.
 */
public final class RequestBodyEncoder {

    public static final short API_VERSION = 0;

    private RequestBodyEncoder() {
    }

    public static void encode(Request request, ByteBufAccessor accessor) {
        accessor.writeShort(request.apiKey().id());
        accessor.writeShort(API_VERSION);
        accessor.writeInt(request.correlationId());
        accessor.writeString(request.clientId());
        if (request instanceof ProduceRequest produce) {
            accessor.writeShort(produce.requiredAcks());
            accessor.writeInt(produce.timeoutMs());
            accessor.writeTopicPartitions(produce.topics(), ByteBufAccessor::writeMessageSet);
        }
        else if (request instanceof FetchRequest fetch) {
            accessor.writeInt(fetch.replicaId());
            accessor.writeInt(fetch.maxWaitMs());
            accessor.writeInt(fetch.minBytes());
            accessor.writeTopicPartitions(fetch.topics(), (a, offset) -> {
                a.writeLong(offset.offset());
                a.writeInt(offset.maxBytes());
            });
        }
        else if (request instanceof OffsetRequest offset) {
            accessor.writeInt(offset.replicaId());
            accessor.writeTopicPartitions(offset.topics(), (a, query) -> {
                a.writeLong(query.time());
                a.writeInt(query.maxNumberOfOffsets());
            });
        }
        else if (request instanceof MetadataRequest metadata) {
            accessor.writeArray(metadata.topics(), ByteBufAccessor::writeString);
        }
        else if (request instanceof OffsetCommitRequest offsetCommit) {
            accessor.writeString(offsetCommit.consumerGroup());
            accessor.writeTopicPartitions(offsetCommit.topics(), (a, commit) -> {
                a.writeLong(commit.offset());
                a.writeString(commit.metadata());
            });
        }
        else if (request instanceof OffsetFetchRequest offsetFetch) {
            accessor.writeString(offsetFetch.consumerGroup());
            accessor.writeArray(offsetFetch.topics().entrySet(), (topicAccessor, topic) -> {
                topicAccessor.writeString(topic.getKey());
                topicAccessor.writeArray(topic.getValue(), ByteBufAccessor::writeInt);
            });
        }
        else if (request instanceof ConsumerMetadataRequest consumerMetadata) {
            accessor.writeString(consumerMetadata.consumerGroup());
        }
        else {
            throw new KafkaCodecException("Cannot encode " + request.getClass().getSimpleName());
        }
    }
}
