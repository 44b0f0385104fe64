/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Optional;

/**
 * The request type discriminants understood by this codec.
 * <p>
 * {@link #LEADER_AND_ISR} and {@link #STOP_REPLICA} are broker-to-broker administrative APIs:
 * their ids are known so that their responses can be recognised, but their bodies are not decoded.
 */
public enum ApiKey {
    PRODUCE(0, true),
    FETCH(1, true),
    OFFSET(2, true),
    METADATA(3, true),
    LEADER_AND_ISR(4, false),
    STOP_REPLICA(5, false),
    OFFSET_COMMIT(8, true),
    OFFSET_FETCH(9, true),
    CONSUMER_METADATA(10, true);

    private final short id;
    private final boolean hasResponseBody;

    ApiKey(int id, boolean hasResponseBody) {
        this.id = (short) id;
        this.hasResponseBody = hasResponseBody;
    }

    public short id() {
        return id;
    }

    /**
     * @return true if this codec decodes (and encodes) the body of responses to this API.
     */
    public boolean hasResponseBody() {
        return hasResponseBody;
    }

    /**
     * Look up an api key by its wire id.
     * @param id the wire id
     * @return the api key, or empty if the id is not one this codec knows.
     */
    public static Optional<ApiKey> forId(short id) {
        for (ApiKey apiKey : values()) {
            if (apiKey.id == id) {
                return Optional.of(apiKey);
            }
        }
        return Optional.empty();
    }
}
