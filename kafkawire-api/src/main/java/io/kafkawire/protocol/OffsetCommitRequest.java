/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Commits consumer group offsets.
 * @param correlationId correlation id
 * @param clientId client id
 * @param consumerGroup consumer group
 * @param topics offset to commit per partition per topic
 */
public record OffsetCommitRequest(int correlationId,
                                  @Nullable String clientId,
                                  @Nullable String consumerGroup,
                                  Map<String, Map<Integer, CommitOffset>> topics)
        implements Request {

    public OffsetCommitRequest {
        topics = TopicPartitions.copyOf(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.OFFSET_COMMIT;
    }

    /**
     * @param offset offset to commit
     * @param metadata opaque metadata stored with the offset
     */
    public record CommitOffset(long offset, @Nullable String metadata) {}
}
