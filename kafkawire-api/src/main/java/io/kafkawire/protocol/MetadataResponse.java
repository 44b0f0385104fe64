/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;

/**
 * @param correlationId correlation id
 * @param brokers brokers of the cluster
 * @param topics metadata of the requested topics
 */
public record MetadataResponse(int correlationId, List<Broker> brokers, List<TopicMetadata> topics) implements Response {
    public MetadataResponse {
        brokers = List.copyOf(brokers);
        topics = List.copyOf(topics);
    }
}
