package com.courier.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for state that a mailbox's coordination thread publishes after the
 * caller has already been answered, such as {@code size()} or storage metrics.
 *
 * <p>Usage:
 * <pre>{@code
 * mailbox.receive();
 * AsyncAssertion.eventually(() -> mailbox.size() == 0, Duration.ofSeconds(2));
 *
 * MailboxState state = AsyncAssertion.awaitValue(mailbox::state, MailboxState.CLOSED, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    private AsyncAssertion() {
    }

    /**
     * Waits until the condition holds.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if the condition does not hold within the timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the condition holds, checking every {@code pollIntervalMs} milliseconds.
     * A condition that throws counts as not holding; the last such error is attached to the
     * failure.
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Deadline deadline = new Deadline(timeout, pollIntervalMs);
        Throwable lastError = null;

        do {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
        } while (deadline.pause());

        throw failure("Condition did not become true within " + timeout, lastError);
    }

    /**
     * Waits until the supplier returns a value equal to {@code expected}.
     *
     * @param <T> the value type
     * @param supplier the value supplier
     * @param expected the expected value, may be null
     * @param timeout the maximum time to wait
     * @return the matching value
     * @throws AssertionError listing the distinct values seen if no match arrives in time
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        return awaitValue(supplier, expected, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Deadline deadline = new Deadline(timeout, pollIntervalMs);
        List<T> seen = new ArrayList<>();
        Throwable lastError = null;

        do {
            try {
                T value = supplier.get();
                if (seen.isEmpty() || !Objects.equals(value, seen.get(seen.size() - 1))) {
                    seen.add(value);
                }
                if (Objects.equals(expected, value)) {
                    return value;
                }
            } catch (RuntimeException e) {
                lastError = e;
            }
        } while (deadline.pause());

        throw failure("Value did not become " + expected + " within " + timeout + ". Values seen: " + seen, lastError);
    }

    /**
     * Re-runs an assertion until it stops throwing.
     *
     * @param assertion the assertion to run
     * @param timeout the maximum time to wait
     * @throws AssertionError carrying the last failure if the assertion never passes
     */
    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        Deadline deadline = new Deadline(timeout, DEFAULT_POLL_INTERVAL_MS);
        Throwable lastError = null;

        do {
            try {
                assertion.run();
                return;
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
        } while (deadline.pause());

        throw failure("Assertion did not succeed within " + timeout, lastError);
    }

    private static AssertionError failure(String message, Throwable lastError) {
        if (lastError == null) {
            return new AssertionError(message);
        }
        return new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
    }

    private static final class Deadline {
        private final long deadlineNanos;
        private final long pollIntervalMs;

        Deadline(Duration timeout, long pollIntervalMs) {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            this.deadlineNanos = System.nanoTime() + timeout.toNanos();
            this.pollIntervalMs = pollIntervalMs;
        }

        /**
         * Sleeps one poll interval.
         *
         * @return false once the deadline has passed
         */
        boolean pause() {
            if (System.nanoTime() >= deadlineNanos) {
                return false;
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
            return true;
        }
    }
}
