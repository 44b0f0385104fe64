/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The header of one partition within a streamed fetch response.
 * @param topic topic
 * @param partition partition
 * @param error error
 * @param highwaterMarkOffset offset at the end of the partition's log
 */
public record PartitionStatus(@Nullable String topic, int partition, KafkaError error, long highwaterMarkOffset) {
    public PartitionStatus {
        Objects.requireNonNull(error);
    }
}
