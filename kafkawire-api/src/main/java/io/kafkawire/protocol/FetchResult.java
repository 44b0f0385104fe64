/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

/**
 * @param error error
 * @param highwaterMarkOffset offset at the end of the partition's log
 * @param messages fetched messages
 */
public record FetchResult(KafkaError error, long highwaterMarkOffset, MessageSet messages) {
    public FetchResult {
        Objects.requireNonNull(error);
        Objects.requireNonNull(messages);
    }
}
