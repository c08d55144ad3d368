package com.courier.storage;

import java.util.Objects;

/**
 * Storage decorator that counts traffic through the wrapped storage.
 *
 * <p>Counters are written only by the owning mailbox's coordination thread and published
 * through volatile fields, so {@link #metrics()} can be called from any thread.
 *
 * @param <T> The type of elements held
 */
public class MeteredStorage<T> implements Storage<T> {

    private final Storage<T> delegate;
    private final int initialSize;

    private volatile long totalAppended = 0;
    private volatile long totalDropped = 0;
    private volatile int highWaterMark;

    /**
     * Wraps a storage, which may already hold elements. Those count towards
     * {@code buffered} and the high-water mark but not towards {@code totalAppended}.
     *
     * @param delegate the storage to meter
     */
    public MeteredStorage(Storage<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate storage cannot be null");
        this.initialSize = delegate.size();
        this.highWaterMark = initialSize;
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public T peek() {
        return delegate.peek();
    }

    @Override
    public void drop() {
        delegate.drop();
        totalDropped++;
    }

    @Override
    public void append(T value) {
        delegate.append(value);
        totalAppended++;
        int size = delegate.size();
        if (size > highWaterMark) {
            highWaterMark = size;
        }
    }

    @Override
    public boolean hasCapacity() {
        return delegate.hasCapacity();
    }

    /**
     * Returns a snapshot of the counters.
     *
     * @return the current metrics
     */
    public StorageMetrics metrics() {
        long dropped = totalDropped;
        long appended = totalAppended;
        return new StorageMetrics(appended, dropped, initialSize + appended - dropped, highWaterMark);
    }
}
