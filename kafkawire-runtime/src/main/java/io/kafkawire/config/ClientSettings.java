/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.config;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.netty.handler.logging.LogLevel;

/**
 * Settings of a client connection to a broker.
 * @param host broker host
 * @param port broker port
 * @param clientId client id sent in request headers
 * @param maxFrameSizeBytes largest response frame accepted
 * @param streamingFetch whether fetch responses are streamed as they arrive rather than decoded whole
 * @param frameLogLevel if present, messages read and written are logged at this level
 */
public record ClientSettings(String host,
                             int port,
                             Optional<String> clientId,
                             Optional<Integer> maxFrameSizeBytes,
                             Optional<Boolean> streamingFetch,
                             Optional<String> frameLogLevel) {

    public static final int DEFAULT_MAX_FRAME_SIZE_BYTES = 104857600;

    public ClientSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalConfigurationException("client host is required");
        }
        ConfigValidation.checkPort("client port", port);
        clientId = Objects.requireNonNullElse(clientId, Optional.empty());
        maxFrameSizeBytes = Objects.requireNonNullElse(maxFrameSizeBytes, Optional.empty());
        streamingFetch = Objects.requireNonNullElse(streamingFetch, Optional.empty());
        frameLogLevel = Objects.requireNonNullElse(frameLogLevel, Optional.empty());
        ConfigValidation.checkPositive("client maxFrameSizeBytes", maxFrameSizeBytes);
        ConfigValidation.logLevel("client frameLogLevel", frameLogLevel);
    }

    public static ClientSettings of(String host, int port) {
        return new ClientSettings(host, port, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public ClientSettings withStreamingFetch(boolean streaming) {
        return new ClientSettings(host, port, clientId, maxFrameSizeBytes, Optional.of(streaming), frameLogLevel);
    }

    @JsonIgnore
    public int activeMaxFrameSizeBytes() {
        return maxFrameSizeBytes.orElse(DEFAULT_MAX_FRAME_SIZE_BYTES);
    }

    @JsonIgnore
    public boolean isStreamingFetch() {
        return streamingFetch.orElse(false);
    }

    @JsonIgnore
    public Optional<LogLevel> activeFrameLogLevel() {
        return ConfigValidation.logLevel("client frameLogLevel", frameLogLevel);
    }
}
