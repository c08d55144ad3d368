package com.courier.mailbox;

import java.util.concurrent.TimeUnit;

/**
 * A thread-safe FIFO mailbox for many concurrent producers and a single logical consumer,
 * with a half-close protocol. Unbounded unless built over bounded storage.
 *
 * <p>After {@link #close()} the mailbox stops accepting messages but keeps delivering the
 * ones already buffered. Once they are all received, every {@code receive} returns
 * {@link Receipt#endOfStream()} immediately.
 *
 * <p><strong>Sending after close:</strong> a send issued after {@link #close()} took effect is
 * never accepted. With a timeout it returns {@code false} once the timeout elapses; without a
 * timeout it blocks until the calling thread is interrupted. Producers that may outlive the
 * consumer should always pass a timeout.
 *
 * @param <T> The type of messages passed through the mailbox
 */
public interface Mailbox<T> extends AutoCloseable {

    /**
     * Hands a message to the mailbox, waiting as long as necessary for it to be accepted.
     *
     * @param message the message to send
     * @return true once the message has been accepted
     * @throws InterruptedException if interrupted before the message was accepted
     * @throws NullPointerException if the message is null
     */
    boolean send(T message) throws InterruptedException;

    /**
     * Hands a message to the mailbox, waiting up to the given time for it to be accepted.
     * A non-positive timeout waits without limit.
     *
     * @param message the message to send
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if the message was accepted, false if the timeout elapsed first
     * @throws InterruptedException if interrupted before the message was accepted
     * @throws NullPointerException if the message or unit is null
     */
    boolean send(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Receives the head message, waiting until one is available or the mailbox is closed
     * and drained.
     *
     * @return a delivered receipt, or an end-of-stream receipt
     * @throws InterruptedException if interrupted before a message was delivered
     */
    Receipt<T> receive() throws InterruptedException;

    /**
     * Receives the head message, waiting up to the given time. A non-positive timeout waits
     * without limit.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return a delivered, timed-out or end-of-stream receipt
     * @throws InterruptedException if interrupted before a message was delivered
     */
    Receipt<T> receive(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Stops accepting messages. Buffered messages remain receivable in FIFO order.
     * Never blocks; calling it again has no effect.
     */
    @Override
    void close();

    /**
     * Returns the lifecycle state last published by the mailbox.
     *
     * @return the current state
     */
    MailboxState state();

    /**
     * Returns the number of buffered messages last published by the mailbox.
     * The value is a snapshot and may already be stale when returned.
     *
     * @return the number of buffered messages
     */
    int size();

    /**
     * Returns true if no messages are buffered.
     *
     * @return true if empty
     */
    default boolean isEmpty() {
        return size() == 0;
    }
}
