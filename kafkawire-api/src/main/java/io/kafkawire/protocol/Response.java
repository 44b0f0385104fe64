/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

/**
 * A response from a broker. Besides one variant per API there are two variants that never appear on the wire:
 * {@link NilResponse}, the answer to a request the broker does not acknowledge, and
 * {@link StreamFetchResponse}, a fetch response whose body is still arriving.
 */
public sealed interface Response
        permits ProduceResponse, FetchResponse, OffsetResponse, MetadataResponse, OffsetCommitResponse, OffsetFetchResponse, ConsumerMetadataResponse,
        NilResponse, StreamFetchResponse {

    /**
     * @return the correlation id of the request this response answers.
     */
    int correlationId();
}
