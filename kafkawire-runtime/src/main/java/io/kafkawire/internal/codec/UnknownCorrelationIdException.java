/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal.codec;

/**
 * A response arrived for a correlation id with no outstanding request.
 */
public class UnknownCorrelationIdException extends KafkaCodecException {

    private final int correlationId;

    public UnknownCorrelationIdException(int correlationId) {
        super("Unknown correlation id " + correlationId);
        this.correlationId = correlationId;
    }

    public int getCorrelationId() {
        return correlationId;
    }
}
