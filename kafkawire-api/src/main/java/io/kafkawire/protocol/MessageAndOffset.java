/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

/**
 * A log entry of a {@link MessageSet}: a message together with its offset in the partition.
 * @param offset the offset of the message
 * @param message the message
 */
public record MessageAndOffset(long offset, Message message) {
    public MessageAndOffset {
        Objects.requireNonNull(message);
    }
}
