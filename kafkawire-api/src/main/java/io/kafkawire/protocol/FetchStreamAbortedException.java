/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

/**
 * Thrown to the consumer of a {@link FetchStream} whose producer failed before the end of the stream,
 * typically because the connection was lost mid-body.
 */
public class FetchStreamAbortedException extends RuntimeException {
    public FetchStreamAbortedException(Throwable cause) {
        super("Fetch stream aborted: " + cause.getMessage(), cause);
    }
}
