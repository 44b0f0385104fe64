/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import io.netty.handler.logging.LogLevel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class ConfigParserTest {
    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());
    private final ConfigParser configParser = new ConfigParser();

    static Stream<Arguments> yamlDeserializeSerializeFidelity() {
        return Stream.of(argumentSet("Empty", """
                {}
                """),
                argumentSet("Client (minimal)", """
                        client:
                          host: localhost
                          port: 9092
                        """),
                argumentSet("Client (streaming)", """
                        client:
                          host: localhost
                          port: 9092
                          clientId: consumer-1
                          maxFrameSizeBytes: 1024
                          streamingFetch: true
                          frameLogLevel: INFO
                        """),
                argumentSet("Server", """
                        server:
                          bindAddress: 0.0.0.0
                          port: 9192
                          frameLogLevel: TRACE
                        netty:
                          workerThreadCount: 4
                        """));
    }

    @ParameterizedTest
    @MethodSource
    void yamlDeserializeSerializeFidelity(String config) throws Exception {
        Configuration configuration = configParser.parseConfiguration(config);

        String yaml = configParser.toYaml(configuration);

        JsonNode expected = MAPPER.readTree(config);
        JsonNode actual = MAPPER.readTree(yaml);
        assertThat(actual).isEqualTo(expected);
        assertThat(configParser.parseConfiguration(yaml)).isEqualTo(configuration);
    }

    @Test
    void shouldApplyDefaults() {
        Configuration configuration = configParser.parseConfiguration("""
                client:
                  host: localhost
                  port: 9092
                server:
                  port: 0
                """);

        ClientSettings client = configuration.client().orElseThrow();
        assertThat(client.clientId()).isEmpty();
        assertThat(client.activeMaxFrameSizeBytes()).isEqualTo(ClientSettings.DEFAULT_MAX_FRAME_SIZE_BYTES);
        assertThat(client.isStreamingFetch()).isFalse();
        assertThat(client.activeFrameLogLevel()).isEmpty();
        ServerSettings server = configuration.server().orElseThrow();
        assertThat(server.bindAddress()).isEmpty();
        assertThat(server.activeMaxFrameSizeBytes()).isEqualTo(ClientSettings.DEFAULT_MAX_FRAME_SIZE_BYTES);
        assertThat(configuration.activeNettySettings().activeWorkerThreadCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void shouldParseFromStream() throws IOException {
        Configuration configuration;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("kafkawire-example.yaml")) {
            configuration = configParser.parseConfiguration(in);
        }

        assertThat(configuration.client()).contains(new ClientSettings("broker.example", 9092, Optional.of("example-client"),
                Optional.empty(), Optional.of(true), Optional.of("debug")));
        assertThat(configuration.client().orElseThrow().activeFrameLogLevel()).contains(LogLevel.DEBUG);
        assertThat(configuration.server().orElseThrow().activeMaxFrameSizeBytes()).isEqualTo(1048576);
        assertThat(configuration.activeNettySettings().activeWorkerThreadCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectUnknownProperty() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                client:
                  host: localhost
                  port: 9092
                  colour: blue
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse configuration")
                .cause()
                .hasMessageContaining("colour");
    }

    @Test
    void shouldRejectDuplicateKey() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                server:
                  port: 9092
                  port: 9093
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .cause()
                .hasMessageContaining("Duplicate field 'port'");
    }

    @Test
    void shouldRejectMissingHost() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                client:
                  port: 9092
                """))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("client host is required");
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 65536 })
    void shouldRejectPortOutOfRange(int port) {
        assertThatThrownBy(() -> configParser.parseConfiguration("server:\n  port: " + port + "\n"))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("server port must be between 0 and 65535");
    }

    @Test
    void shouldRejectNonPositiveFrameSize() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                client:
                  host: localhost
                  port: 9092
                  maxFrameSizeBytes: 0
                """))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("client maxFrameSizeBytes must be positive, was 0");
    }

    @Test
    void shouldRejectUnknownLogLevel() {
        assertThatThrownBy(() -> configParser.parseConfiguration("""
                server:
                  port: 9092
                  frameLogLevel: LOUD
                """))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("LOUD");
    }

    @Test
    void shouldRejectNonPositiveWorkerThreadCount() {
        assertThatThrownBy(() -> new NettySettings(Optional.of(0)))
                .isInstanceOf(IllegalConfigurationException.class);
    }

    @Test
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> configParser.parseConfiguration("client: [unclosed"))
                .isInstanceOf(IllegalArgumentException.class)
                .isNotInstanceOf(IllegalConfigurationException.class);
    }
}
