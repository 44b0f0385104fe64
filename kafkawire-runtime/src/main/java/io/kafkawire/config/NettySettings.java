/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.config;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * @param workerThreadCount number of event loop threads serving connections, defaulting to the number of processors
 */
public record NettySettings(Optional<Integer> workerThreadCount) {

    public NettySettings {
        workerThreadCount = Objects.requireNonNullElse(workerThreadCount, Optional.empty());
        ConfigValidation.checkPositive("workerThreadCount", workerThreadCount);
    }

    public static NettySettings defaults() {
        return new NettySettings(Optional.empty());
    }

    @JsonIgnore
    public int activeWorkerThreadCount() {
        return workerThreadCount.orElse(Runtime.getRuntime().availableProcessors());
    }
}
