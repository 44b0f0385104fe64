/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.kafkawire.tag.VisibleForTesting;

/**
 * Reads and writes {@link Configuration} as YAML.
 * Unknown properties and duplicate keys are rejected.
 */
public class ConfigParser {

    private static final ObjectMapper MAPPER = createObjectMapper();

    /**
     * @param configuration YAML text
     * @return the configuration
     * @throws IllegalArgumentException if the text cannot be parsed
     * @throws IllegalConfigurationException if a value is out of range
     */
    public Configuration parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, Configuration.class);
        }
        catch (IOException e) {
            throw parseFailure(e);
        }
    }

    /**
     * @param configuration YAML stream
     * @return the configuration
     * @throws IllegalArgumentException if the stream cannot be parsed
     * @throws IllegalConfigurationException if a value is out of range
     */
    public Configuration parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, Configuration.class);
        }
        catch (IOException e) {
            throw parseFailure(e);
        }
    }

    public String toYaml(Configuration configuration) {
        try {
            return MAPPER.writeValueAsString(configuration);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode configuration as YAML", e);
        }
    }

    private static RuntimeException parseFailure(IOException e) {
        // range checks are made by the record constructors Jackson calls
        if (e instanceof ValueInstantiationException && e.getCause() instanceof IllegalConfigurationException illegal) {
            return illegal;
        }
        return new IllegalArgumentException("Couldn't parse configuration", e);
    }

    @VisibleForTesting
    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
    }
}
