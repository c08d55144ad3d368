package com.courier.mailbox;

import com.courier.storage.Storage;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Single owner of a mailbox's storage.
 *
 * <p>Callers never touch the storage. They submit requests into a lock-free MPSC inbox and
 * wait on the {@link Reply} carried by the request; the loop thread is the only code that
 * calls {@link Storage} methods. The loop claims a reply before it appends or drops, and a
 * caller that gives up withdraws it, so a caller that gave up first never has its send
 * applied or a message consumed on its behalf. A claimed reply is answered with the outcome
 * of the storage call, including a failure.
 *
 * <p>Loop state:
 * <ul>
 *   <li>{@code closing}: set by the close request, never cleared. Sends are no longer accepted.</li>
 *   <li>{@code receivers}: receive offers waiting for a message.</li>
 *   <li>{@code blockedSenders}: sends waiting for storage capacity (bounded storage only).</li>
 * </ul>
 * Withdrawn waiters are pruned from the head of each deque as it is served, and the whole
 * deque is swept once it doubles in size since the last sweep.
 * The loop terminates once {@code closing} is set and the storage is empty.
 *
 * @param <T> The type of messages
 */
class CoordinationLoop<T> implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(CoordinationLoop.class);

    private static final int INBOX_CHUNK_SIZE = 128;
    private static final int MIN_SWEEP_SIZE = 64;

    private final String name;
    private final Storage<T> storage;
    private final boolean failFastAfterClose;
    private final MpscUnboundedArrayQueue<Request<T>> inbox;
    private final ArrayDeque<ReceiveRequest<T>> receivers = new ArrayDeque<>();
    private final ArrayDeque<SendRequest<T>> blockedSenders = new ArrayDeque<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Thread thread;

    // Owned by the loop thread
    private boolean closing = false;
    private int receiversSweepAt = MIN_SWEEP_SIZE;
    private int sendersSweepAt = MIN_SWEEP_SIZE;

    // Published by the loop thread
    private volatile MailboxState state = MailboxState.OPEN;
    private volatile int size;
    private volatile int waitingReceivers;
    private volatile int waitingSenders;
    private volatile boolean terminated = false;
    private volatile Throwable failure;

    CoordinationLoop(String name, Storage<T> storage, boolean failFastAfterClose, ThreadFactory threadFactory) {
        this.name = name;
        this.storage = storage;
        this.failFastAfterClose = failFastAfterClose;
        this.inbox = new MpscUnboundedArrayQueue<>(INBOX_CHUNK_SIZE);
        this.size = storage.size();
        this.thread = threadFactory.newThread(this);
    }

    void start() {
        thread.start();
    }

    /**
     * Hands a request to the loop. Safe to call from any thread.
     */
    void submit(Request<T> request) {
        inbox.offer(request);
        LockSupport.unpark(thread);
    }

    MailboxState state() {
        return state;
    }

    int size() {
        return size;
    }

    int waitingReceivers() {
        return waitingReceivers;
    }

    int waitingSenders() {
        return waitingSenders;
    }

    boolean isTerminated() {
        return terminated;
    }

    Throwable failure() {
        return failure;
    }

    boolean isFailFastAfterClose() {
        return failFastAfterClose;
    }

    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    @Override
    public void run() {
        logger.debug("Mailbox {} coordination loop started on {}", name, Thread.currentThread().getName());
        try {
            while (!terminated) {
                Request<T> request = inbox.poll();
                if (request == null) {
                    LockSupport.park(this);
                    if (Thread.interrupted()) {
                        logger.warn("Mailbox {} coordination thread was interrupted; close the mailbox to stop it", name);
                    }
                    continue;
                }
                dispatch(request);
                settle();
                size = storage.size();
                waitingReceivers = receivers.size();
                waitingSenders = blockedSenders.size();
            }
            logger.debug("Mailbox {} coordination loop finished", name);
        } catch (RuntimeException | Error e) {
            fail(e);
        } finally {
            stopped.countDown();
        }
    }

    private void dispatch(Request<T> request) {
        if (request instanceof SendRequest<T> send) {
            onSend(send);
        } else if (request instanceof ReceiveRequest<T> receive) {
            onReceive(receive);
        } else {
            onClose();
        }
    }

    private void onSend(SendRequest<T> send) {
        if (closing) {
            logger.trace("Mailbox {} discarding send offered after close", name);
            rejectAfterClose(send);
            return;
        }
        pruneAbandoned(blockedSenders);
        if (blockedSenders.isEmpty() && storage.hasCapacity()) {
            accept(send);
        } else if (!send.isAbandoned()) {
            blockedSenders.addLast(send);
            sendersSweepAt = sweepIfGrown(blockedSenders, sendersSweepAt);
        }
    }

    private void onReceive(ReceiveRequest<T> receive) {
        pruneAbandoned(receivers);
        if (!receive.isAbandoned()) {
            receivers.addLast(receive);
            receiversSweepAt = sweepIfGrown(receivers, receiversSweepAt);
        }
    }

    private void onClose() {
        if (closing) {
            return;
        }
        closing = true;
        if (!blockedSenders.isEmpty()) {
            logger.debug("Mailbox {} abandoning {} senders waiting for capacity", name, blockedSenders.size());
            for (SendRequest<T> send : blockedSenders) {
                rejectAfterClose(send);
            }
            blockedSenders.clear();
        }
        if (storage.size() > 0) {
            state = MailboxState.DRAINING;
            logger.debug("Mailbox {} closed, draining {} buffered messages", name, storage.size());
        }
    }

    /**
     * Matches buffered messages with waiting receivers and admits waiting senders while
     * capacity allows, then terminates if closed and empty.
     */
    private void settle() {
        boolean progressed;
        do {
            progressed = deliverHeads();
            if (!closing) {
                progressed |= admitBlockedSenders();
            }
        } while (progressed);

        if (closing && storage.size() == 0) {
            terminate();
        }
    }

    private boolean deliverHeads() {
        boolean delivered = false;
        while (storage.size() > 0 && !receivers.isEmpty()) {
            T head = storage.peek();
            Reply<Receipt<T>> reply = receivers.pollFirst().reply();
            if (reply.claim()) {
                try {
                    storage.drop();
                } catch (RuntimeException | Error e) {
                    reply.fail(e);
                    throw e;
                }
                reply.complete(Receipt.delivered(head));
                delivered = true;
            }
        }
        return delivered;
    }

    private boolean admitBlockedSenders() {
        boolean admitted = false;
        while (!blockedSenders.isEmpty() && storage.hasCapacity()) {
            SendRequest<T> send = blockedSenders.pollFirst();
            admitted |= accept(send);
        }
        return admitted;
    }

    private boolean accept(SendRequest<T> send) {
        Reply<Boolean> reply = send.reply();
        if (!reply.claim()) {
            return false;
        }
        try {
            storage.append(send.message());
        } catch (RuntimeException | Error e) {
            reply.fail(e);
            throw e;
        }
        reply.complete(Boolean.TRUE);
        return true;
    }

    private void rejectAfterClose(SendRequest<T> send) {
        if (failFastAfterClose) {
            send.reply().tryComplete(Boolean.FALSE);
        }
    }

    private void terminate() {
        state = MailboxState.CLOSED;
        size = 0;
        terminated = true;
        for (ReceiveRequest<T> receiver : receivers) {
            receiver.reply().tryComplete(Receipt.endOfStream());
        }
        receivers.clear();
        waitingReceivers = 0;
        waitingSenders = 0;
        // Requests that raced with termination; later ones answer themselves.
        Request<T> request;
        while ((request = inbox.poll()) != null) {
            if (request instanceof ReceiveRequest<T> receive) {
                receive.reply().tryComplete(Receipt.endOfStream());
            } else if (request instanceof SendRequest<T> send) {
                rejectAfterClose(send);
            }
        }
        logger.debug("Mailbox {} closed and drained", name);
    }

    private void fail(Throwable cause) {
        logger.error("Mailbox {} coordination loop failed, closing mailbox", name, cause);
        failure = cause;
        state = MailboxState.CLOSED;
        terminated = true;
        for (ReceiveRequest<T> receiver : receivers) {
            receiver.reply().tryFail(cause);
        }
        receivers.clear();
        for (SendRequest<T> send : blockedSenders) {
            send.reply().tryFail(cause);
        }
        blockedSenders.clear();
        waitingReceivers = 0;
        waitingSenders = 0;
        Request<T> request;
        while ((request = inbox.poll()) != null) {
            if (request instanceof ReceiveRequest<T> receive) {
                receive.reply().tryFail(cause);
            } else if (request instanceof SendRequest<T> send) {
                send.reply().tryFail(cause);
            }
        }
    }

    private static void pruneAbandoned(ArrayDeque<? extends Request<?>> waiting) {
        while (!waiting.isEmpty() && waiting.peekFirst().isAbandoned()) {
            waiting.pollFirst();
        }
    }

    /**
     * Removes withdrawn waiters anywhere in the deque once it reaches {@code sweepAt}.
     * Waiters behind a live head are otherwise only pruned when they reach the head.
     *
     * @return the size at which to sweep next
     */
    private static int sweepIfGrown(ArrayDeque<? extends Request<?>> waiting, int sweepAt) {
        if (waiting.size() < sweepAt) {
            return sweepAt;
        }
        waiting.removeIf(Request::isAbandoned);
        return Math.max(MIN_SWEEP_SIZE, waiting.size() * 2);
    }

    /**
     * A message to the coordination loop.
     */
    sealed interface Request<T> permits SendRequest, ReceiveRequest, CloseRequest {
        /**
         * @return true if the caller has already stopped waiting for an answer
         */
        boolean isAbandoned();
    }

    record SendRequest<T>(T message, Reply<Boolean> reply) implements Request<T> {
        @Override
        public boolean isAbandoned() {
            return reply.isWithdrawn();
        }
    }

    record ReceiveRequest<T>(Reply<Receipt<T>> reply) implements Request<T> {
        @Override
        public boolean isAbandoned() {
            return reply.isWithdrawn();
        }
    }

    record CloseRequest<T>() implements Request<T> {
        @Override
        public boolean isAbandoned() {
            return false;
        }
    }
}
