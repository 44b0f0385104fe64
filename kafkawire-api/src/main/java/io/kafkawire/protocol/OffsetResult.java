/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;
import java.util.Objects;

/**
 * @param error error
 * @param offsets offsets, in descending order
 */
public record OffsetResult(KafkaError error, List<Long> offsets) {
    public OffsetResult {
        Objects.requireNonNull(error);
        offsets = List.copyOf(offsets);
    }
}
