/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param error error
 * @param id partition id
 * @param leader leader of the partition, absent while a leader is being elected
 * @param replicas brokers holding a replica
 * @param isr replicas in sync with the leader
 */
public record PartitionMetadata(KafkaError error, int id, Optional<Broker> leader, List<Broker> replicas, List<Broker> isr) {
    public PartitionMetadata {
        Objects.requireNonNull(error);
        Objects.requireNonNull(leader);
        replicas = List.copyOf(replicas);
        isr = List.copyOf(isr);
    }
}
