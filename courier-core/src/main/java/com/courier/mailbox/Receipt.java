package com.courier.mailbox;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a receive.
 *
 * <p>{@link #isDelivered()} is the ok-flag: it is false both when the wait timed out and when
 * the mailbox has reached end-of-stream. {@link #outcome()} tells the two apart.
 *
 * @param message the delivered message, or null if nothing was delivered
 * @param outcome how the receive ended
 * @param <T> The type of the message
 */
public record Receipt<T>(T message, Outcome outcome) {

    private static final Receipt<?> TIMED_OUT = new Receipt<>(null, Outcome.TIMED_OUT);
    private static final Receipt<?> END_OF_STREAM = new Receipt<>(null, Outcome.END_OF_STREAM);

    /**
     * How a receive ended.
     */
    public enum Outcome {
        DELIVERED,
        TIMED_OUT,
        END_OF_STREAM
    }

    public Receipt {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
        if (outcome == Outcome.DELIVERED) {
            Objects.requireNonNull(message, "Delivered message cannot be null");
        } else if (message != null) {
            throw new IllegalArgumentException("Only a delivered receipt carries a message");
        }
    }

    /**
     * @param message the delivered message
     * @param <T> the message type
     * @return a receipt carrying the message
     */
    public static <T> Receipt<T> delivered(T message) {
        return new Receipt<>(message, Outcome.DELIVERED);
    }

    /**
     * @param <T> the message type
     * @return the shared receipt for a receive whose timeout elapsed
     */
    @SuppressWarnings("unchecked")
    public static <T> Receipt<T> timedOut() {
        return (Receipt<T>) TIMED_OUT;
    }

    /**
     * @param <T> the message type
     * @return the shared receipt for a receive on a closed and drained mailbox
     */
    @SuppressWarnings("unchecked")
    public static <T> Receipt<T> endOfStream() {
        return (Receipt<T>) END_OF_STREAM;
    }

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }

    public boolean isTimedOut() {
        return outcome == Outcome.TIMED_OUT;
    }

    public boolean isEndOfStream() {
        return outcome == Outcome.END_OF_STREAM;
    }

    /**
     * @return the message if one was delivered
     */
    public Optional<T> toOptional() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return isDelivered() ? "Receipt[" + message + "]" : "Receipt[" + outcome + "]";
    }
}
