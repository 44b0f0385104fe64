/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single producer, single consumer handoff of capacity one.
 * <p>
 * The producer (a connection's read path) never waits: {@link #offer(Object, Runnable)} refuses an item while the
 * previous one has not been taken, and calls back once the slot is free so the producer can hold back its
 * source in the meantime. The producer ends the stream with {@link #close()}, or with {@link #fail(Throwable)}
 * if it cannot reach the end.
 * </p>
 * <p>
 * A consumer that is no longer interested must call {@link #discard()}: the remaining items are then dropped
 * so that the producer can get through to the end of the stream.
 * </p>
 * @param <T> item type
 */
public final class FetchStream<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private @Nullable T slot;
    private boolean closed;
    private boolean discarded;
    private @Nullable Throwable failure;
    private @Nullable Runnable slotFreeListener;

    /**
     * Hand an item to the consumer if the slot is free.
     * @param item item
     * @param onSlotFree run once the slot is next freed, if the item was refused. Runs on the thread that frees the
     * slot, outside any lock.
     * @return true if the item was handed off, or dropped because the stream was discarded.
     * False if the previous item has not been taken yet.
     * @throws IllegalStateException if the stream has already ended
     */
    public boolean offer(T item, Runnable onSlotFree) {
        Objects.requireNonNull(item);
        Objects.requireNonNull(onSlotFree);
        lock.lock();
        try {
            if (closed || failure != null) {
                throw new IllegalStateException("Stream has already ended");
            }
            if (discarded) {
                return true;
            }
            if (slot != null) {
                slotFreeListener = onSlotFree;
                return false;
            }
            slot = item;
            notEmpty.signal();
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * End the stream normally. Consumers see the items already handed off followed by the end.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * End the stream abnormally. Has no effect on a stream that has already ended.
     * @param cause the reason the stream could not be completed
     */
    public void fail(Throwable cause) {
        lock.lock();
        try {
            if (!closed && failure == null) {
                failure = cause;
                notEmpty.signalAll();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Take the next item, waiting for it if necessary.
     * @return the next item, or empty if the stream has ended or was discarded.
     * @throws InterruptedException if interrupted while waiting
     * @throws FetchStreamAbortedException if the producer failed
     */
    public Optional<T> take() throws InterruptedException {
        Optional<T> item;
        lock.lock();
        try {
            while (isPending()) {
                notEmpty.await();
            }
            item = next();
        }
        finally {
            lock.unlock();
        }
        notifySlotFree();
        return item;
    }

    /**
     * Take the next item, waiting at most the given time for it.
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return the next item, or empty if the stream has ended or was discarded.
     * @throws InterruptedException if interrupted while waiting
     * @throws TimeoutException if no item arrived within the timeout
     * @throws FetchStreamAbortedException if the producer failed
     */
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        long remaining = unit.toNanos(timeout);
        Optional<T> item;
        lock.lock();
        try {
            while (isPending()) {
                if (remaining <= 0L) {
                    throw new TimeoutException("No item within " + timeout + " " + unit);
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            item = next();
        }
        finally {
            lock.unlock();
        }
        notifySlotFree();
        return item;
    }

    /**
     * Take every remaining item.
     * @return the items, in order
     * @throws InterruptedException if interrupted while waiting
     * @throws FetchStreamAbortedException if the producer failed
     */
    public List<T> drain() throws InterruptedException {
        List<T> items = new ArrayList<>();
        Optional<T> item;
        while ((item = take()).isPresent()) {
            items.add(item.get());
        }
        return items;
    }

    /**
     * Abandon the stream. Any item waiting to be taken and every later item are dropped.
     */
    public void discard() {
        lock.lock();
        try {
            discarded = true;
            slot = null;
            notEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
        notifySlotFree();
    }

    public boolean isDiscarded() {
        lock.lock();
        try {
            return discarded;
        }
        finally {
            lock.unlock();
        }
    }

    private boolean isPending() {
        return slot == null && !closed && !discarded && failure == null;
    }

    private Optional<T> next() {
        if (slot != null) {
            T item = slot;
            slot = null;
            return Optional.of(item);
        }
        if (failure != null && !discarded) {
            throw new FetchStreamAbortedException(failure);
        }
        return Optional.empty();
    }

    private void notifySlotFree() {
        Runnable listener;
        lock.lock();
        try {
            if (slot != null) {
                return;
            }
            listener = slotFreeListener;
            slotFreeListener = null;
        }
        finally {
            lock.unlock();
        }
        if (listener != null) {
            listener.run();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "FetchStream(closed=" + closed + ", discarded=" + discarded + ", failed=" + (failure != null) + ')';
        }
        finally {
            lock.unlock();
        }
    }
}
