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
public record OffsetResponse(int correlationId, Map<String, Map<Integer, OffsetResult>> results) implements Response {
    public OffsetResponse {
        results = TopicPartitions.copyOf(results);
    }
}
