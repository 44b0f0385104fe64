/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

/**
 * Bytes received from, or about to be sent to, a peer cannot be interpreted according to the protocol.
 * The connection is no longer in a known state and should be closed.
 */
public class KafkaCodecException extends RuntimeException {

    public KafkaCodecException(String message) {
        super(message);
    }

    public KafkaCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
