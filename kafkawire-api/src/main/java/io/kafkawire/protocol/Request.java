/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A request sent by a client to a broker. Every request carries the v0 request header fields.
 */
public sealed interface Request
        permits ProduceRequest, FetchRequest, OffsetRequest, MetadataRequest, OffsetCommitRequest, OffsetFetchRequest, ConsumerMetadataRequest {

    /**
     * @return the id echoed back by the broker in the response to this request.
     */
    int correlationId();

    @Nullable
    String clientId();

    ApiKey apiKey();

    /**
     * @return false if the broker will not answer this request.
     */
    default boolean expectsResponse() {
        return true;
    }
}
