/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Asks for the valid offsets of partitions before a given time.
 * @param correlationId correlation id
 * @param clientId client id
 * @param replicaId broker id of a follower, or -1 for ordinary consumers
 * @param topics query per partition per topic
 */
public record OffsetRequest(int correlationId,
                            @Nullable String clientId,
                            int replicaId,
                            Map<String, Map<Integer, OffsetQuery>> topics)
        implements Request {

    public static final long LATEST_TIME = -1L;
    public static final long EARLIEST_TIME = -2L;

    public OffsetRequest {
        topics = TopicPartitions.copyOf(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.OFFSET;
    }

    /**
     * @param time millisecond timestamp, or one of {@link #LATEST_TIME} and {@link #EARLIEST_TIME}
     * @param maxNumberOfOffsets maximum number of offsets returned
     */
    public record OffsetQuery(long time, int maxNumberOfOffsets) {}
}
