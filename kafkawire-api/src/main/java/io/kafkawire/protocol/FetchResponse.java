/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

/**
 * A fetch response decoded in full.
 * @param correlationId correlation id
 * @param results result per partition per topic
 */
public record FetchResponse(int correlationId, Map<String, Map<Integer, FetchResult>> results) implements Response {
    public FetchResponse {
        results = TopicPartitions.copyOf(results);
    }
}
