/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Fetches message sets from partitions.
 * @param correlationId correlation id
 * @param clientId client id
 * @param replicaId broker id of a follower, or -1 for ordinary consumers
 * @param maxWaitMs maximum time the broker blocks waiting for {@code minBytes}
 * @param minBytes minimum number of bytes to accumulate before responding
 * @param topics position and size limit per partition per topic
 */
public record FetchRequest(int correlationId,
                           @Nullable String clientId,
                           int replicaId,
                           int maxWaitMs,
                           int minBytes,
                           Map<String, Map<Integer, FetchOffset>> topics)
        implements Request {

    public static final int CONSUMER_REPLICA_ID = -1;

    public FetchRequest {
        topics = TopicPartitions.copyOf(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.FETCH;
    }

    /**
     * @param offset offset to begin fetching from
     * @param maxBytes maximum bytes of the partition's message set
     */
    public record FetchOffset(long offset, int maxBytes) {}
}
