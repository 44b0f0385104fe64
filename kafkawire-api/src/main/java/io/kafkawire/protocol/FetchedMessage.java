/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One message within a streamed fetch response.
 * @param topic topic
 * @param partition partition
 * @param offset offset of the message
 * @param payload the message
 */
public record FetchedMessage(@Nullable String topic, int partition, long offset, Message payload) {
    public FetchedMessage {
        Objects.requireNonNull(payload);
    }
}
