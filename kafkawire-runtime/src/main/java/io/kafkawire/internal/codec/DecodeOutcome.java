/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.Objects;

/**
 * What a {@link KafkaMessageDecoder} made of one inbound message.
 */
public sealed interface DecodeOutcome {

    static DecodeOutcome emit(Object message) {
        return new Emit(message);
    }

    static DecodeOutcome consumed() {
        return Consumed.INSTANCE;
    }

    static DecodeOutcome failed(KafkaCodecException cause) {
        return new Failed(cause);
    }

    /**
     * Pass the given message to the next handler.
     * @param message the decoded message, or the inbound message itself if it is not handled here
     */
    record Emit(Object message) implements DecodeOutcome {
        public Emit {
            Objects.requireNonNull(message);
        }
    }

    /**
     * The message was fully handled and nothing is passed on.
     */
    enum Consumed implements DecodeOutcome {
        INSTANCE
    }

    /**
     * The message could not be decoded. The connection can no longer be trusted.
     * @param cause the reason
     */
    record Failed(KafkaCodecException cause) implements DecodeOutcome {
        public Failed {
            Objects.requireNonNull(cause);
        }
    }
}
