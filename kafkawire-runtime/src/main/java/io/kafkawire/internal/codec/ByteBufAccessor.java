/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

import io.kafkawire.protocol.MessageSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads and writes the primitive types of the Kafka protocol.
 * Every read checks the bytes remaining and fails with a {@link KafkaCodecException} rather than reading beyond them.
 */
public interface ByteBufAccessor {

    short readShort();

    int readInt();

    long readLong();

    /**
     * Read an int16 length prefixed UTF-8 string.
     * @return the string, or null if the length is -1
     */
    @Nullable
    String readString();

    /**
     * Read an int32 count followed by that many elements.
     * @param elementReader reads one element
     * @return the elements
     * @param <T> element type
     */
    <T> List<T> readArray(Function<ByteBufAccessor, T> elementReader);

    /**
     * Read an int32 size followed by that many bytes of log entries.
     * @return the message set
     */
    MessageSet readMessageSet();

    int remaining();

    void writeShort(short val);

    void writeInt(int val);

    void writeLong(long val);

    void writeString(@Nullable String val);

    <T> void writeArray(Collection<T> elements, BiConsumer<ByteBufAccessor, T> elementWriter);

    void writeMessageSet(MessageSet messageSet);

    /**
     * Read the {@code [topic [partition ...]]} structure shared by most request and response bodies.
     * @param partitionReader reads the fields following the partition id
     * @return the values per partition per topic, in wire order
     * @param <V> partition value type
     */
    default <V> Map<String, Map<Integer, V>> readTopicPartitions(Function<ByteBufAccessor, V> partitionReader) {
        Map<String, Map<Integer, V>> topics = new LinkedHashMap<>();
        readArray(topicAccessor -> {
            String topic = topicAccessor.readString();
            Map<Integer, V> partitions = new LinkedHashMap<>();
            topicAccessor.readArray(partitionAccessor -> {
                int partition = partitionAccessor.readInt();
                partitions.put(partition, partitionReader.apply(partitionAccessor));
                return partition;
            });
            topics.put(topic, partitions);
            return topic;
        });
        return topics;
    }

    /**
     * Write the {@code [topic [partition ...]]} structure shared by most request and response bodies.
     * @param topics the values per partition per topic
     * @param partitionWriter writes the fields following the partition id
     * @param <V> partition value type
     */
    default <V> void writeTopicPartitions(Map<String, Map<Integer, V>> topics, BiConsumer<ByteBufAccessor, V> partitionWriter) {
        writeArray(topics.entrySet(), (topicAccessor, topic) -> {
            topicAccessor.writeString(topic.getKey());
            topicAccessor.writeArray(topic.getValue().entrySet(), (partitionAccessor, partition) -> {
                partitionAccessor.writeInt(partition.getKey());
                partitionWriter.accept(partitionAccessor, partition.getValue());
            });
        });
    }
}
