/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An opaque region of log entries as carried by Produce requests and Fetch responses.
 * <p>
 * The bytes are kept exactly as they were read, so a set read from the wire is written back unchanged.
 * {@link #entries()} interprets the bytes on demand.
 * </p>
 * <pre>
 * MessageSet => [Offset MessageSize Message]
 *   Offset => int64
 *   MessageSize => int32
 * </pre>
 */
public final class MessageSet {

    /** offset + message size */
    public static final int LOG_OVERHEAD = 8 + 4;

    public static final MessageSet EMPTY = new MessageSet(new byte[0]);

    private final byte[] bytes;

    private MessageSet(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * @param bytes the encoded log entries, which are copied
     * @return a message set over a copy of the given bytes
     */
    public static MessageSet wrap(byte[] bytes) {
        return bytes.length == 0 ? EMPTY : new MessageSet(bytes.clone());
    }

    public static MessageSet of(MessageAndOffset... entries) {
        return of(Arrays.asList(entries));
    }

    public static MessageSet of(List<MessageAndOffset> entries) {
        int size = 0;
        for (MessageAndOffset entry : entries) {
            size += LOG_OVERHEAD + entry.message().sizeInBytes();
        }
        ByteBuffer buffer = ByteBuffer.allocate(size);
        for (MessageAndOffset entry : entries) {
            buffer.putLong(entry.offset());
            buffer.putInt(entry.message().sizeInBytes());
            entry.message().writeTo(buffer);
        }
        return new MessageSet(buffer.array());
    }

    public int sizeInBytes() {
        return bytes.length;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Interpret the log entries of this set.
     * A trailing entry that is cut short is ignored: brokers may truncate the last entry of a fetched set
     * at the requested maximum size.
     * @return the complete entries, in order
     * @throws IllegalArgumentException if an entry is malformed
     */
    public List<MessageAndOffset> entries() {
        List<MessageAndOffset> entries = new ArrayList<>();
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.remaining() >= LOG_OVERHEAD) {
            long offset = buffer.getLong();
            int messageSize = buffer.getInt();
            if (messageSize < 0) {
                throw new IllegalArgumentException("Negative message size " + messageSize + " at offset " + offset);
            }
            if (messageSize > buffer.remaining()) {
                break;
            }
            ByteBuffer message = buffer.slice().limit(messageSize);
            entries.add(new MessageAndOffset(offset, Message.readFrom(message)));
            buffer.position(buffer.position() + messageSize);
        }
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((MessageSet) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "MessageSet(sizeInBytes=" + bytes.length + ')';
    }
}
