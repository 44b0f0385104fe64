/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The header of a request frame this codec cannot decode: an unknown API, an unsupported API
 * or a version other than 0. The body has been skipped.
 * @param apiKey api key id
 * @param apiVersion api version
 * @param correlationId correlation id
 * @param clientId client id
 * @param bodySize size in bytes of the skipped body
 */
public record OpaqueRequestFrame(short apiKey, short apiVersion, int correlationId, @Nullable String clientId, int bodySize) {}
