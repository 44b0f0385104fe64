/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.config;

import java.util.Locale;
import java.util.Optional;

import io.netty.handler.logging.LogLevel;

final class ConfigValidation {

    private ConfigValidation() {
    }

    static int checkPort(String property, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalConfigurationException(property + " must be between 0 and 65535, was " + port);
        }
        return port;
    }

    static void checkPositive(String property, Optional<Integer> value) {
        value.filter(v -> v <= 0).ifPresent(v -> {
            throw new IllegalConfigurationException(property + " must be positive, was " + v);
        });
    }

    static Optional<LogLevel> logLevel(String property, Optional<String> level) {
        return level.map(name -> {
            try {
                return LogLevel.valueOf(name.toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalConfigurationException(property + " must be one of TRACE, DEBUG, INFO, WARN or ERROR, was " + name);
            }
        });
    }
}
