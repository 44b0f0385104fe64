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
 * Settings of a server accepting Kafka protocol connections.
 * @param bindAddress address to listen on, defaulting to all interfaces
 * @param port port to listen on, 0 for an ephemeral port
 * @param maxFrameSizeBytes largest request frame accepted
 * @param frameLogLevel if present, messages read and written are logged at this level
 */
public record ServerSettings(Optional<String> bindAddress,
                             int port,
                             Optional<Integer> maxFrameSizeBytes,
                             Optional<String> frameLogLevel) {

    public ServerSettings {
        bindAddress = Objects.requireNonNullElse(bindAddress, Optional.empty());
        ConfigValidation.checkPort("server port", port);
        maxFrameSizeBytes = Objects.requireNonNullElse(maxFrameSizeBytes, Optional.empty());
        frameLogLevel = Objects.requireNonNullElse(frameLogLevel, Optional.empty());
        ConfigValidation.checkPositive("server maxFrameSizeBytes", maxFrameSizeBytes);
        ConfigValidation.logLevel("server frameLogLevel", frameLogLevel);
    }

    public static ServerSettings onPort(int port) {
        return new ServerSettings(Optional.empty(), port, Optional.empty(), Optional.empty());
    }

    @JsonIgnore
    public int activeMaxFrameSizeBytes() {
        return maxFrameSizeBytes.orElse(ClientSettings.DEFAULT_MAX_FRAME_SIZE_BYTES);
    }

    @JsonIgnore
    public Optional<LogLevel> activeFrameLogLevel() {
        return ConfigValidation.logLevel("server frameLogLevel", frameLogLevel);
    }
}
