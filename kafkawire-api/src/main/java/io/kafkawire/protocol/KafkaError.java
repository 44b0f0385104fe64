/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.HashMap;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The numeric error codes carried inline by Kafka responses.
 * <p>
 * A {@code KafkaError} is data, not an exception: the codec decodes it into the result records and never
 * interprets it. Every code is kept as received, so a code without a name here, such as one introduced by
 * a newer broker, encodes back to the same value. Two errors are equal when their codes are.
 * </p>
 */
public final class KafkaError {

    private static final Map<Short, KafkaError> NAMED = new HashMap<>();

    public static final KafkaError UNKNOWN = named(-1, "UNKNOWN");
    public static final KafkaError NONE = named(0, "NONE");
    public static final KafkaError OFFSET_OUT_OF_RANGE = named(1, "OFFSET_OUT_OF_RANGE");
    public static final KafkaError INVALID_MESSAGE = named(2, "INVALID_MESSAGE");
    public static final KafkaError UNKNOWN_TOPIC_OR_PARTITION = named(3, "UNKNOWN_TOPIC_OR_PARTITION");
    public static final KafkaError INVALID_MESSAGE_SIZE = named(4, "INVALID_MESSAGE_SIZE");
    public static final KafkaError LEADER_NOT_AVAILABLE = named(5, "LEADER_NOT_AVAILABLE");
    public static final KafkaError NOT_LEADER_FOR_PARTITION = named(6, "NOT_LEADER_FOR_PARTITION");
    public static final KafkaError REQUEST_TIMED_OUT = named(7, "REQUEST_TIMED_OUT");
    public static final KafkaError BROKER_NOT_AVAILABLE = named(8, "BROKER_NOT_AVAILABLE");
    public static final KafkaError REPLICA_NOT_AVAILABLE = named(9, "REPLICA_NOT_AVAILABLE");
    public static final KafkaError MESSAGE_SIZE_TOO_LARGE = named(10, "MESSAGE_SIZE_TOO_LARGE");
    public static final KafkaError STALE_CONTROLLER_EPOCH = named(11, "STALE_CONTROLLER_EPOCH");
    public static final KafkaError OFFSET_METADATA_TOO_LARGE = named(12, "OFFSET_METADATA_TOO_LARGE");
    public static final KafkaError STALE_LEADER_EPOCH = named(13, "STALE_LEADER_EPOCH");
    public static final KafkaError OFFSETS_LOAD_IN_PROGRESS = named(14, "OFFSETS_LOAD_IN_PROGRESS");
    public static final KafkaError CONSUMER_COORDINATOR_NOT_AVAILABLE = named(15, "CONSUMER_COORDINATOR_NOT_AVAILABLE");
    public static final KafkaError NOT_COORDINATOR_FOR_CONSUMER = named(16, "NOT_COORDINATOR_FOR_CONSUMER");

    private final short code;
    private final @Nullable String name;

    private KafkaError(short code, @Nullable String name) {
        this.code = code;
        this.name = name;
    }

    private static KafkaError named(int code, String name) {
        KafkaError error = new KafkaError((short) code, name);
        NAMED.put(error.code, error);
        return error;
    }

    public short code() {
        return code;
    }

    /**
     * @return true if this code has a name in this class.
     */
    public boolean isNamed() {
        return name != null;
    }

    public boolean isSuccess() {
        return code == NONE.code;
    }

    /**
     * @param code error code read from the wire
     * @return the named error with that code, or an unnamed error keeping the code
     */
    public static KafkaError forCode(short code) {
        KafkaError error = NAMED.get(code);
        return error == null ? new KafkaError(code, null) : error;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof KafkaError other && other.code == code);
    }

    @Override
    public int hashCode() {
        return Short.hashCode(code);
    }

    @Override
    public String toString() {
        return name != null ? name : "KafkaError(" + code + ")";
    }
}
