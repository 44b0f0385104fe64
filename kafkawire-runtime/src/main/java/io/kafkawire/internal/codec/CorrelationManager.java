/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kafkawire.protocol.ApiKey;

/**
 * Remembers the API of each outstanding request on a connection, so the response decoder
 * knows how to interpret a response given only its correlation id.
 * <p>
 * Requests are registered on the write path and resolved on the read path, which may run
 * on different threads while requests are pipelined.
 * </p>
 */
public class CorrelationManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationManager.class);

    private final Map<Integer, ApiKey> brokerRequests = new ConcurrentHashMap<>();

    /**
     * Record an outstanding request.
     * @param correlationId The correlation id of the request.
     * @param apiKey The API of the request.
     * @throws IllegalStateException if a request with the same correlation id is still outstanding.
     */
    public void register(int correlationId, ApiKey apiKey) {
        ApiKey existing = brokerRequests.putIfAbsent(correlationId, apiKey);
        if (existing != null) {
            throw new IllegalStateException("Duplicate correlation id " + correlationId + " (outstanding " + existing + " request)");
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Registered {} request with correlation id {}", apiKey, correlationId);
        }
    }

    /**
     * Remove and return the API of an outstanding request.
     * @param correlationId The correlation id read from a response.
     * @return the API of the request.
     * @throws UnknownCorrelationIdException if there is no outstanding request with that correlation id.
     */
    public ApiKey resolve(int correlationId) {
        return tryResolve(correlationId).orElseThrow(() -> new UnknownCorrelationIdException(correlationId));
    }

    /**
     * Remove and return the API of an outstanding request, if there is one.
     * @param correlationId The correlation id read from a response.
     * @return the API of the request, or empty.
     */
    public Optional<ApiKey> tryResolve(int correlationId) {
        return Optional.ofNullable(brokerRequests.remove(correlationId));
    }

    /**
     * @return the number of outstanding requests.
     */
    public int outstanding() {
        return brokerRequests.size();
    }
}
