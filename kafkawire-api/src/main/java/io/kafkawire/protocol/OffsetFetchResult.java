/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param offset committed offset, or -1 if none
 * @param metadata metadata committed with the offset
 * @param error error
 */
public record OffsetFetchResult(long offset, @Nullable String metadata, KafkaError error) {
    public OffsetFetchResult {
        Objects.requireNonNull(error);
    }
}
