/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

/**
 * @param correlationId correlation id
 * @param results result per partition per topic
 */
public record OffsetCommitResponse(int correlationId, Map<String, Map<Integer, OffsetCommitResult>> results) implements Response {
    public OffsetCommitResponse {
        results = TopicPartitions.copyOf(results);
    }
}
