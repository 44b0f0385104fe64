/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.zip.CRC32;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single (magic v0) Kafka message: the payload of one log entry within a {@link MessageSet}.
 * <pre>
 * Message => Crc MagicByte Attributes Key Value
 *   Crc => int32
 *   MagicByte => int8
 *   Attributes => int8
 *   Key => bytes
 *   Value => bytes
 * </pre>
 * The crc covers every field that follows it. Compressed wrapper messages are not expanded:
 * their compression codec is visible in {@link #attributes()} and their value is the compressed inner set.
 */
public final class Message {

    public static final byte MAGIC_V0 = 0;

    /** crc + magic + attributes + key length + value length */
    private static final int HEADER_SIZE = 4 + 1 + 1 + 4 + 4;

    private final byte magic;
    private final byte attributes;
    private final @Nullable byte[] key;
    private final @Nullable byte[] value;

    public Message(@Nullable byte[] key, @Nullable byte[] value) {
        this(MAGIC_V0, (byte) 0, key, value);
    }

    public Message(byte magic, byte attributes, @Nullable byte[] key, @Nullable byte[] value) {
        this.magic = magic;
        this.attributes = attributes;
        this.key = key == null ? null : key.clone();
        this.value = value == null ? null : value.clone();
    }

    public byte magic() {
        return magic;
    }

    public byte attributes() {
        return attributes;
    }

    public @Nullable byte[] key() {
        return key == null ? null : key.clone();
    }

    public @Nullable byte[] value() {
        return value == null ? null : value.clone();
    }

    /**
     * @return the number of bytes this message occupies on the wire, crc included.
     */
    public int sizeInBytes() {
        return HEADER_SIZE + length(key) + length(value);
    }

    /**
     * @return the CRC32 of the fields following the crc, as an unsigned value.
     */
    public long crc() {
        ByteBuffer buffer = ByteBuffer.allocate(sizeInBytes());
        writeTo(buffer);
        return computeCrc(buffer.array(), 4, buffer.capacity() - 4);
    }

    /**
     * Write this message, crc first, to the given buffer.
     * @param out destination, which must have {@link #sizeInBytes()} bytes remaining
     */
    public void writeTo(ByteBuffer out) {
        int start = out.position();
        out.putInt(0); // crc placeholder
        out.put(magic);
        out.put(attributes);
        writeBytes(out, key);
        writeBytes(out, value);
        byte[] covered = new byte[out.position() - start - 4];
        out.duplicate().position(start + 4).get(covered);
        out.putInt(start, (int) computeCrc(covered, 0, covered.length));
    }

    /**
     * Read a message occupying all the remaining bytes of the given buffer.
     * @param in the message bytes
     * @return the message
     * @throws IllegalArgumentException if the bytes are not a well-formed message or its crc does not match.
     */
    public static Message readFrom(ByteBuffer in) {
        if (in.remaining() < HEADER_SIZE) {
            throw new IllegalArgumentException("Message of " + in.remaining() + " byte(s) is shorter than the " + HEADER_SIZE + " byte header");
        }
        int start = in.position();
        long storedCrc = Integer.toUnsignedLong(in.getInt());
        byte magic = in.get();
        byte attributes = in.get();
        byte[] key = readBytes(in, "key");
        byte[] value = readBytes(in, "value");
        if (in.hasRemaining()) {
            throw new IllegalArgumentException("Message has " + in.remaining() + " unexpected trailing byte(s)");
        }
        ByteBuffer covered = in.duplicate().position(start + 4);
        byte[] coveredBytes = new byte[in.position() - start - 4];
        covered.get(coveredBytes);
        long actualCrc = computeCrc(coveredBytes, 0, coveredBytes.length);
        if (actualCrc != storedCrc) {
            throw new IllegalArgumentException("Message is corrupt (stored crc = " + storedCrc + ", computed crc = " + actualCrc + ")");
        }
        return new Message(magic, attributes, key, value);
    }

    private static @Nullable byte[] readBytes(ByteBuffer in, String field) {
        if (in.remaining() < 4) {
            throw new IllegalArgumentException("Message " + field + " length is truncated");
        }
        int length = in.getInt();
        if (length < 0) {
            return null;
        }
        if (length > in.remaining()) {
            throw new IllegalArgumentException("Message " + field + " of " + length + " byte(s): only " + in.remaining() + " byte(s) available");
        }
        byte[] bytes = new byte[length];
        in.get(bytes);
        return bytes;
    }

    private static void writeBytes(ByteBuffer out, @Nullable byte[] bytes) {
        if (bytes == null) {
            out.putInt(-1);
        }
        else {
            out.putInt(bytes.length);
            out.put(bytes);
        }
    }

    private static int length(@Nullable byte[] bytes) {
        return bytes == null ? 0 : bytes.length;
    }

    private static long computeCrc(byte[] bytes, int offset, int length) {
        CRC32 crc = new CRC32();
        crc.update(bytes, offset, length);
        return crc.getValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Message that = (Message) o;
        return magic == that.magic
                && attributes == that.attributes
                && Arrays.equals(key, that.key)
                && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = 31 * magic + attributes;
        result = 31 * result + Arrays.hashCode(key);
        return 31 * result + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Message(" +
                "magic=" + magic +
                ", attributes=" + attributes +
                ", keySize=" + (key == null ? -1 : key.length) +
                ", valueSize=" + (value == null ? -1 : value.length) +
                ')';
    }
}
