/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.kafkawire.protocol.ApiKey;
import io.kafkawire.protocol.ConsumerMetadataRequest;
import io.kafkawire.protocol.FetchRequest;
import io.kafkawire.protocol.MetadataRequest;
import io.kafkawire.protocol.OffsetCommitRequest;
import io.kafkawire.protocol.OffsetFetchRequest;
import io.kafkawire.protocol.OffsetRequest;
import io.kafkawire.protocol.ProduceRequest;
import io.kafkawire.protocol.Request;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decodes v0 request bodies, that is everything after the request header.
 */
public final class RequestBodyDecoder {

    private RequestBodyDecoder() {
    }

    public static Request decode(ApiKey apiKey, int correlationId, @Nullable String clientId, ByteBufAccessor accessor) {
        return switch (apiKey) {
            case PRODUCE -> {
                short requiredAcks = accessor.readShort();
                int timeoutMs = accessor.readInt();
                yield new ProduceRequest(correlationId, clientId, requiredAcks, timeoutMs, accessor.readTopicPartitions(ByteBufAccessor::readMessageSet));
            }
            case FETCH -> {
                int replicaId = accessor.readInt();
                int maxWaitMs = accessor.readInt();
                int minBytes = accessor.readInt();
                yield new FetchRequest(correlationId, clientId, replicaId, maxWaitMs, minBytes,
                        accessor.readTopicPartitions(a -> {
                            long offset = a.readLong();
                            return new FetchRequest.FetchOffset(offset, a.readInt());
                        }));
            }
            case OFFSET -> {
                int replicaId = accessor.readInt();
                yield new OffsetRequest(correlationId, clientId, replicaId,
                        accessor.readTopicPartitions(a -> {
                            long time = a.readLong();
                            return new OffsetRequest.OffsetQuery(time, a.readInt());
                        }));
            }
            case METADATA -> new MetadataRequest(correlationId, clientId, accessor.readArray(ByteBufAccessor::readString));
            case OFFSET_COMMIT -> {
                String consumerGroup = accessor.readString();
                yield new OffsetCommitRequest(correlationId, clientId, consumerGroup,
                        accessor.readTopicPartitions(a -> {
                            long offset = a.readLong();
                            return new OffsetCommitRequest.CommitOffset(offset, a.readString());
                        }));
            }
            case OFFSET_FETCH -> {
                String consumerGroup = accessor.readString();
                Map<String, List<Integer>> topics = new LinkedHashMap<>();
                accessor.readArray(topicAccessor -> {
                    String topic = topicAccessor.readString();
                    topics.put(topic, topicAccessor.readArray(ByteBufAccessor::readInt));
                    return topic;
                });
                yield new OffsetFetchRequest(correlationId, clientId, consumerGroup, topics);
            }
            case CONSUMER_METADATA -> new ConsumerMetadataRequest(correlationId, clientId, accessor.readString());
            case LEADER_AND_ISR, STOP_REPLICA -> throw new KafkaCodecException(apiKey + " requests are not supported");
        };
    }
}
