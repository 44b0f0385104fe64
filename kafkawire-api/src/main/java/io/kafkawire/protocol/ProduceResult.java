/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Objects;

/**
 * @param error error
 * @param offset offset assigned to the first appended message
 */
public record ProduceResult(KafkaError error, long offset) {
    public ProduceResult {
        Objects.requireNonNull(error);
    }
}
