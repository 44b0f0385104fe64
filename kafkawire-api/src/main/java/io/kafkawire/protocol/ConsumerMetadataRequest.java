/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Locates the offset coordinator of a consumer group.
 * @param correlationId correlation id
 * @param clientId client id
 * @param consumerGroup consumer group
 */
public record ConsumerMetadataRequest(int correlationId,
                                      @Nullable String clientId,
                                      @Nullable String consumerGroup)
        implements Request {

    @Override
    public ApiKey apiKey() {
        return ApiKey.CONSUMER_METADATA;
    }
}
