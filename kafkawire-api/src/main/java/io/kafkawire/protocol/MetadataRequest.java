/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Asks for brokers and topic metadata.
 * @param correlationId correlation id
 * @param clientId client id
 * @param topics topics to describe; empty for all topics
 */
public record MetadataRequest(int correlationId,
                              @Nullable String clientId,
                              List<String> topics)
        implements Request {

    public MetadataRequest {
        topics = List.copyOf(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.METADATA;
    }
}
