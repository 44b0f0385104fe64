/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.server;

import java.util.OptionalInt;

/**
 * An inbound value that could not be dispatched as a request, such as a frame for an API or version
 * that is not decoded. No response is written for it and the connection stays open.
 */
public class RejectedRequestException extends RuntimeException {

    private final OptionalInt correlationId;

    public RejectedRequestException(String message, OptionalInt correlationId) {
        super(message);
        this.correlationId = correlationId;
    }

    /**
     * @return the correlation id of the rejected request, if its header could be read.
     */
    public OptionalInt correlationId() {
        return correlationId;
    }
}
