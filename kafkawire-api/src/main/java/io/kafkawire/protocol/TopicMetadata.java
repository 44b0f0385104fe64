/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

public record TopicMetadata(KafkaError error, @Nullable String name, List<PartitionMetadata> partitions) {
    public TopicMetadata {
        Objects.requireNonNull(error);
        partitions = List.copyOf(partitions);
    }
}
