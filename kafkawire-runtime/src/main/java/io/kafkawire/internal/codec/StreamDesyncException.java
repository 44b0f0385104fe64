/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal.codec;

/**
 * A streamed fetch response event arrived out of sequence.
 */
public class StreamDesyncException extends KafkaCodecException {

    public StreamDesyncException(String message) {
        super(message);
    }
}
