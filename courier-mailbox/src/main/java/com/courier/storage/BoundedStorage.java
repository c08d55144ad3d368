package com.courier.storage;

import java.util.Objects;

/**
 * Storage decorator that caps the number of buffered elements.
 *
 * <p>When full, {@link #hasCapacity()} returns false and the owning mailbox holds senders
 * back until a receive frees a slot, which gives producers backpressure.
 *
 * @param <T> The type of elements held
 */
public class BoundedStorage<T> implements Storage<T> {

    private final Storage<T> delegate;
    private final int capacity;

    /**
     * @param delegate the storage that holds the elements
     * @param capacity the maximum number of elements
     * @throws IllegalArgumentException if capacity is not positive
     */
    public BoundedStorage(Storage<T> delegate, int capacity) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate storage cannot be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
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
    }

    /**
     * @throws IllegalStateException if the storage is already full
     */
    @Override
    public void append(T value) {
        if (!hasCapacity()) {
            throw new IllegalStateException("Storage is full (capacity " + capacity + ")");
        }
        delegate.append(value);
    }

    @Override
    public boolean hasCapacity() {
        return delegate.size() < capacity && delegate.hasCapacity();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return the number of elements that can still be appended
     */
    public int remainingCapacity() {
        return capacity - delegate.size();
    }
}
