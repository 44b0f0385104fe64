/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies of the topic to partition tables carried by requests and responses.
 * The copies are unmodifiable and keep the iteration order of their source, which is the order they are encoded in.
 */
final class TopicPartitions {

    private TopicPartitions() {
    }

    static <V> Map<String, Map<Integer, V>> copyOf(Map<String, Map<Integer, V>> topics) {
        Map<String, Map<Integer, V>> copy = new LinkedHashMap<>();
        topics.forEach((topic, partitions) -> copy.put(topic, Collections.unmodifiableMap(new LinkedHashMap<>(partitions))));
        return Collections.unmodifiableMap(copy);
    }

    static Map<String, List<Integer>> copyOfLists(Map<String, List<Integer>> topics) {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        topics.forEach((topic, partitions) -> copy.put(topic, List.copyOf(partitions)));
        return Collections.unmodifiableMap(copy);
    }
}
