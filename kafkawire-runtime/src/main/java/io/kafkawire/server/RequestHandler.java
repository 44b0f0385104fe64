/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.server;

import java.util.concurrent.CompletionStage;

import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;

/**
 * Services the requests of one connection. A connection's requests are handed over one at a time:
 * {@link #handle(Request)} is not called again until the stage it returned has completed.
 */
@FunctionalInterface
public interface RequestHandler extends AutoCloseable {

    /**
     * Handle a request.
     * @param request the request
     * @return the response, or a {@link NilResponse} if nothing should be written back.
     * Completing exceptionally closes the connection.
     */
    CompletionStage<Response> handle(Request request);

    /**
     * Called, in turn with the requests around it, for an inbound value that could not be dispatched.
     * Nothing is written back and the connection stays open. Throwing closes the connection.
     * @param failure what was rejected and why
     */
    default void rejected(RejectedRequestException failure) {
    }

    /**
     * Called once the connection has closed.
     */
    @Override
    default void close() {
    }
}
