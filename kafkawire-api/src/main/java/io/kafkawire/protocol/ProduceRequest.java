/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Appends message sets to partitions.
 * @param correlationId correlation id
 * @param clientId client id
 * @param requiredAcks number of acknowledgements the broker waits for; 0 means the broker sends no response
 * @param timeoutMs time the broker may wait for the acknowledgements
 * @param topics message set per partition per topic
 */
public record ProduceRequest(int correlationId,
                             @Nullable String clientId,
                             short requiredAcks,
                             int timeoutMs,
                             Map<String, Map<Integer, MessageSet>> topics)
        implements Request {

    public ProduceRequest {
        topics = TopicPartitions.copyOf(topics);
    }

    @Override
    public ApiKey apiKey() {
        return ApiKey.PRODUCE;
    }

    @Override
    public boolean expectsResponse() {
        return requiredAcks != 0;
    }
}
