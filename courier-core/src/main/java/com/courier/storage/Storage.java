package com.courier.storage;

/**
 * Ordered buffer a mailbox delegates to. Implementations must keep FIFO order:
 * elements leave through {@link #peek()}/{@link #drop()} in the order they were appended.
 *
 * <p>A storage instance is owned by exactly one mailbox and is only ever called from that
 * mailbox's coordination thread, so implementations need no synchronization of their own.
 * Bounded, persistent or metered backends can be substituted as long as they keep the
 * ordering and the preconditions below.
 *
 * @param <T> The type of elements held
 */
public interface Storage<T> {

    /**
     * @return the number of buffered elements
     */
    int size();

    /**
     * Returns the head element without removing it.
     *
     * @return the head element
     * @throws java.util.NoSuchElementException if the storage is empty
     */
    T peek();

    /**
     * Removes the head element.
     *
     * @throws java.util.NoSuchElementException if the storage is empty
     */
    void drop();

    /**
     * Appends an element at the tail.
     *
     * @param value the element to append
     */
    void append(T value);

    /**
     * Returns whether another element can be appended now. The mailbox only appends when
     * this returns true; senders wait otherwise.
     *
     * @return true unless the storage is bounded and full
     */
    default boolean hasCapacity() {
        return true;
    }

    /**
     * @return true if no elements are buffered
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
