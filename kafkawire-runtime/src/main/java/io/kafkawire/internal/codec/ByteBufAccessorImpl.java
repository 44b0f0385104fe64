/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import io.kafkawire.protocol.MessageSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An implementation of {@link ByteBufAccessor} in terms of a Netty ByteBuf.
 * Reads are confined to the readable bytes of the buffer, so a decoder given a slice of one frame
 * cannot read into the next.
 */
public class ByteBufAccessorImpl implements ByteBufAccessor {

    private final ByteBuf buf;

    /**
     * Create accessor
     * @param buf underlying buffer to access
     */
    public ByteBufAccessorImpl(ByteBuf buf) {
        this.buf = buf;
    }

    private static KafkaCodecException illegalReadException(String what, int size, int remaining) {
        return new KafkaCodecException("Error reading " + what + " of " + size + " byte(s): only " + remaining +
                " byte(s) available");
    }

    private void ensureReadable(String what, int size) {
        int remaining = buf.readableBytes();
        if (size > remaining) {
            throw illegalReadException(what, size, remaining);
        }
    }

    @Override
    public short readShort() {
        ensureReadable("int16", Short.BYTES);
        return buf.readShort();
    }

    @Override
    public int readInt() {
        ensureReadable("int32", Integer.BYTES);
        return buf.readInt();
    }

    @Override
    public long readLong() {
        ensureReadable("int64", Long.BYTES);
        return buf.readLong();
    }

    @Override
    public @Nullable String readString() {
        short length = readShort();
        if (length == -1) {
            return null;
        }
        if (length < 0) {
            throw new KafkaCodecException("Illegal string length " + length);
        }
        ensureReadable("string", length);
        String value = buf.toString(buf.readerIndex(), length, StandardCharsets.UTF_8);
        buf.skipBytes(length);
        return value;
    }

    @Override
    public <T> List<T> readArray(Function<ByteBufAccessor, T> elementReader) {
        int count = readInt();
        if (count < 0) {
            throw new KafkaCodecException("Illegal array length " + count);
        }
        // every element occupies at least one byte
        ensureReadable("array of " + count + " element(s)", count);
        List<T> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            elements.add(elementReader.apply(this));
        }
        return elements;
    }

    @Override
    public MessageSet readMessageSet() {
        int size = readInt();
        if (size < 0) {
            throw new KafkaCodecException("Illegal message set size " + size);
        }
        ensureReadable("message set", size);
        byte[] bytes = ByteBufUtil.getBytes(buf, buf.readerIndex(), size, false);
        buf.skipBytes(size);
        return MessageSet.wrap(bytes);
    }

    @Override
    public int remaining() {
        return buf.readableBytes();
    }

    @Override
    public void writeShort(short val) {
        buf.writeShort(val);
    }

    @Override
    public void writeInt(int val) {
        buf.writeInt(val);
    }

    @Override
    public void writeLong(long val) {
        buf.writeLong(val);
    }

    @Override
    public void writeString(@Nullable String val) {
        if (val == null) {
            buf.writeShort(-1);
            return;
        }
        byte[] bytes = val.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > Short.MAX_VALUE) {
            throw new KafkaCodecException("String of " + bytes.length + " byte(s) is longer than the maximum of " + Short.MAX_VALUE);
        }
        buf.writeShort(bytes.length);
        buf.writeBytes(bytes);
    }

    @Override
    public <T> void writeArray(Collection<T> elements, BiConsumer<ByteBufAccessor, T> elementWriter) {
        buf.writeInt(elements.size());
        for (T element : elements) {
            elementWriter.accept(this, element);
        }
    }

    @Override
    public void writeMessageSet(MessageSet messageSet) {
        buf.writeInt(messageSet.sizeInBytes());
        buf.writeBytes(messageSet.toByteArray());
    }

    @Override
    public String toString() {
        return "ByteBufAccessorImpl(" + buf + ')';
    }
}
