/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

/**
 * The answer to a request the broker does not respond to, such as a produce with {@code requiredAcks == 0}.
 * Nothing is written to the peer for it.
 * @param correlationId correlation id of the unanswered request
 */
public record NilResponse(int correlationId) implements Response {}
