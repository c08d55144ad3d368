package com.courier.storage;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Default unbounded storage backed by an {@link ArrayDeque}, which grows as needed.
 *
 * <p>Not thread-safe; see {@link Storage}.
 *
 * @param <T> The type of elements held
 */
public class ArrayDequeStorage<T> implements Storage<T> {

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    private final ArrayDeque<T> elements;

    /**
     * Creates an empty storage with the default initial capacity.
     */
    public ArrayDequeStorage() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * Creates an empty storage sized for the given number of elements.
     * This is a sizing hint only; the storage stays unbounded.
     *
     * @param initialCapacity the expected number of elements, treated as 1 if not positive
     */
    public ArrayDequeStorage(int initialCapacity) {
        this.elements = new ArrayDeque<>(Math.max(1, initialCapacity));
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public T peek() {
        return elements.element();
    }

    @Override
    public void drop() {
        elements.remove();
    }

    @Override
    public void append(T value) {
        Objects.requireNonNull(value, "Value cannot be null");
        elements.addLast(value);
    }

    @Override
    public String toString() {
        return "ArrayDequeStorage{size=" + elements.size() + "}";
    }
}
