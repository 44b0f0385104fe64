/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

public record ConsumerMetadataResponse(int correlationId, ConsumerMetadataResult result) implements Response {
    public ConsumerMetadataResponse {
        Objects.requireNonNull(result);
    }
}
