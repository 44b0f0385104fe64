/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param error error
 * @param coordinatorId node id of the group's offset coordinator
 * @param coordinatorHost host of the coordinator
 * @param coordinatorPort port of the coordinator
 */
public record ConsumerMetadataResult(KafkaError error, int coordinatorId, @Nullable String coordinatorHost, int coordinatorPort) {
    public ConsumerMetadataResult {
        Objects.requireNonNull(error);
    }
}
