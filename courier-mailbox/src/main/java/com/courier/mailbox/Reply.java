package com.courier.mailbox;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answer slot shared by a waiting caller and the coordination loop.
 *
 * <p>Exactly one side settles it first: the loop by {@link #claim() claiming} it before it
 * touches storage, or the caller by {@link #withdraw() withdrawing} after a timeout or
 * interrupt. A claimed reply is always completed afterwards, with a value or with the
 * failure raised while applying it.
 *
 * @param <R> The type of the answer
 */
final class Reply<R> {
    private static final int WAITING = 0;
    private static final int CLAIMED = 1;
    private static final int WITHDRAWN = 2;

    private final AtomicInteger status = new AtomicInteger(WAITING);
    private final CompletableFuture<R> future = new CompletableFuture<>();

    /**
     * @return true if the loop now owns this reply and must complete it
     */
    boolean claim() {
        return status.compareAndSet(WAITING, CLAIMED);
    }

    /**
     * @return true if the caller gave up before the loop claimed the reply
     */
    boolean withdraw() {
        return status.compareAndSet(WAITING, WITHDRAWN);
    }

    boolean isWithdrawn() {
        return status.get() == WITHDRAWN;
    }

    void complete(R value) {
        future.complete(value);
    }

    void fail(Throwable cause) {
        future.completeExceptionally(cause);
    }

    /**
     * Claims and completes in one step.
     *
     * @return false if the reply was already settled
     */
    boolean tryComplete(R value) {
        if (!claim()) {
            return false;
        }
        complete(value);
        return true;
    }

    boolean tryFail(Throwable cause) {
        if (!claim()) {
            return false;
        }
        fail(cause);
        return true;
    }

    CompletableFuture<R> future() {
        return future;
    }
}
