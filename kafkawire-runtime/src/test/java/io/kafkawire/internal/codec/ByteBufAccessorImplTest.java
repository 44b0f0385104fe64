/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal.codec;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import io.kafkawire.protocol.Message;
import io.kafkawire.protocol.MessageAndOffset;
import io.kafkawire.protocol.MessageSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ByteBufAccessorImplTest {

    private final ByteBuf buf = Unpooled.buffer();
    private final ByteBufAccessor accessor = new ByteBufAccessorImpl(buf);

    @Test
    void integersAreBigEndian() {
        accessor.writeShort((short) 0x0102);
        accessor.writeInt(0x03040506);
        accessor.writeLong(0x0708090A0B0C0D0EL);

        byte[] bytes = new byte[buf.readableBytes()];
        buf.getBytes(0, bytes);
        assertThat(bytes).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14);
        assertThat(accessor.readShort()).isEqualTo((short) 0x0102);
        assertThat(accessor.readInt()).isEqualTo(0x03040506);
        assertThat(accessor.readLong()).isEqualTo(0x0708090A0B0C0D0EL);
        assertThat(accessor.remaining()).isZero();
    }

    @Test
    void nullStringIsLengthMinusOne() {
        accessor.writeString(null);

        assertThat(buf.getShort(0)).isEqualTo((short) -1);
        assertThat(accessor.readString()).isNull();
    }

    @Test
    void stringIsLengthPrefixedUtf8() {
        accessor.writeString("héllo");

        assertThat(buf.getShort(0)).isEqualTo((short) "héllo".getBytes(StandardCharsets.UTF_8).length);
        assertThat(accessor.readString()).isEqualTo("héllo");
    }

    @Test
    void emptyStringIsNotNull() {
        accessor.writeString("");
        assertThat(accessor.readString()).isEmpty();
    }

    @Test
    void stringLongerThanBufferFailsWithoutReadingBeyondIt() {
        buf.writeShort(10);
        buf.writeBytes("abc".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(accessor::readString)
                .isInstanceOf(KafkaCodecException.class)
                .hasMessage("Error reading string of 10 byte(s): only 3 byte(s) available");
    }

    @Test
    void negativeStringLengthOtherThanMinusOneFails() {
        buf.writeShort(-2);
        assertThatThrownBy(accessor::readString).isInstanceOf(KafkaCodecException.class);
    }

    @Test
    void truncatedIntegerFails() {
        buf.writeShort(1);
        assertThatThrownBy(accessor::readInt)
                .isInstanceOf(KafkaCodecException.class)
                .hasMessageContaining("int32");
        assertThatThrownBy(accessor::readLong)
                .isInstanceOf(KafkaCodecException.class)
                .hasMessageContaining("int64");
    }

    @Test
    void emptyArrayRoundTripsToEmptyList() {
        accessor.writeArray(List.<Integer> of(), ByteBufAccessor::writeInt);

        assertThat(buf.readableBytes()).isEqualTo(4);
        assertThat(accessor.readArray(ByteBufAccessor::readInt)).isEmpty();
    }

    @Test
    void arrayElementsInOrder() {
        accessor.writeArray(List.of(3, 1, 2), ByteBufAccessor::writeInt);
        assertThat(accessor.readArray(ByteBufAccessor::readInt)).containsExactly(3, 1, 2);
    }

    @Test
    void arrayCountBeyondRemainingBytesFails() {
        buf.writeInt(Integer.MAX_VALUE);
        assertThatThrownBy(() -> accessor.readArray(ByteBufAccessor::readInt)).isInstanceOf(KafkaCodecException.class);
    }

    @Test
    void negativeArrayCountFails() {
        buf.writeInt(-1);
        assertThatThrownBy(() -> accessor.readArray(ByteBufAccessor::readInt))
                .isInstanceOf(KafkaCodecException.class)
                .hasMessage("Illegal array length -1");
    }

    @Test
    void messageSetBytesPassThroughUnchanged() {
        MessageSet messageSet = MessageSet.of(new MessageAndOffset(3, new Message(null, new byte[]{ 1, 2, 3 })));
        accessor.writeMessageSet(messageSet);

        assertThat(buf.getInt(0)).isEqualTo(messageSet.sizeInBytes());
        MessageSet read = accessor.readMessageSet();
        assertThat(read.toByteArray()).isEqualTo(messageSet.toByteArray());
    }

    @Test
    void messageSetLongerThanBufferFails() {
        buf.writeInt(100);
        buf.writeLong(0);
        assertThatThrownBy(accessor::readMessageSet)
                .isInstanceOf(KafkaCodecException.class)
                .hasMessage("Error reading message set of 100 byte(s): only 8 byte(s) available");
    }

    @Test
    void topicPartitionsKeepWireOrder() {
        Map<String, Map<Integer, Long>> topics = new LinkedHashMap<>();
        topics.put("b", Map.of(1, 10L));
        topics.put("a", Map.of(0, 20L));
        accessor.writeTopicPartitions(topics, ByteBufAccessor::writeLong);

        Map<String, Map<Integer, Long>> read = accessor.readTopicPartitions(ByteBufAccessor::readLong);
        assertThat(read).containsExactly(Map.entry("b", Map.of(1, 10L)), Map.entry("a", Map.of(0, 20L)));
        assertThat(accessor.remaining()).isZero();
    }
}
