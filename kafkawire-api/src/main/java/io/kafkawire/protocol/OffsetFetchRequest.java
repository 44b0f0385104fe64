/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Fetches committed consumer group offsets.
 * @param correlationId correlation id
 * @param clientId client id
 * @param consumerGroup consumer group
 * @param topics partitions per topic
 */
public record OffsetFetchRequest(int correlationId,
                                 @Nullable String clientId,
                                 @Nullable String consumerGroup,
                                 Map<String, List<Integer>> topics)
        implements Request {

    public OffsetFetchRequest {
        topics = TopicPartitions.copyOfLists(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.OFFSET_FETCH;
    }
}
