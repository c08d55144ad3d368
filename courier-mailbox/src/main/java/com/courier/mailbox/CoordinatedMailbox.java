package com.courier.mailbox;

import com.courier.config.MailboxConfig;
import com.courier.mailbox.CoordinationLoop.CloseRequest;
import com.courier.mailbox.CoordinationLoop.ReceiveRequest;
import com.courier.mailbox.CoordinationLoop.SendRequest;
import com.courier.storage.MeteredStorage;
import com.courier.storage.Storage;
import com.courier.storage.StorageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mailbox whose storage is owned by a single coordination loop running on its own thread.
 *
 * <p>No lock guards the storage: every send, receive and close is relayed to the loop, which
 * is the only code that reads or writes it. Callers block on the reply to their request.
 *
 * <p>Characteristics:
 * <ul>
 *   <li>Global FIFO order in the order sends were accepted</li>
 *   <li>Each message is delivered to exactly one receiver</li>
 *   <li>A send or receive that times out or is interrupted never takes effect</li>
 *   <li>After close, buffered messages drain before receivers see end-of-stream</li>
 * </ul>
 *
 * <p>The storage handed to the constructor belongs to the mailbox from then on and must not
 * be used by the caller again.
 *
 * <p>Usage:
 * <pre>{@code
 * Mailbox<String> mailbox = new CoordinatedMailbox<>(new ArrayDequeStorage<>());
 * mailbox.send("VAL");
 * Receipt<String> receipt = mailbox.receive();   // Receipt[VAL]
 * mailbox.close();
 * mailbox.receive();                             // Receipt[END_OF_STREAM]
 * }</pre>
 *
 * @param <T> The type of messages
 */
public class CoordinatedMailbox<T> implements Mailbox<T> {
    private static final Logger logger = LoggerFactory.getLogger(CoordinatedMailbox.class);

    private final String name;
    private final Storage<T> storage;
    private final CoordinationLoop<T> loop;
    private final AtomicBoolean closeSignalled = new AtomicBoolean(false);

    /**
     * Creates a mailbox over the given storage with default configuration and starts its
     * coordination loop.
     *
     * @param storage the storage to buffer messages in, typically empty
     */
    public CoordinatedMailbox(Storage<T> storage) {
        this(storage, new MailboxConfig());
    }

    /**
     * Creates a mailbox over the given storage and starts its coordination loop.
     * Storage-related settings of the config are not applied here; see
     * {@link com.courier.config.DefaultMailboxProvider} for building storage from config.
     *
     * @param storage the storage to buffer messages in, typically empty
     * @param config the mailbox configuration
     */
    public CoordinatedMailbox(Storage<T> storage, MailboxConfig config) {
        this.storage = Objects.requireNonNull(storage, "Storage cannot be null");
        Objects.requireNonNull(config, "Config cannot be null").validate();
        this.name = config.getName();
        this.loop = new CoordinationLoop<>(name, storage, config.isFailFastAfterClose(),
                config.resolveThreadFactory());
        loop.start();
        logger.debug("Mailbox {} started over {}", name, storage.getClass().getSimpleName());
    }

    @Override
    public boolean send(T message) throws InterruptedException {
        return send(message, 0, TimeUnit.NANOSECONDS);
    }

    @Override
    public boolean send(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(unit, "Time unit cannot be null");
        checkNotFailed();

        if (closeSignalled.get()) {
            if (loop.isFailFastAfterClose()) {
                return false;
            }
            // Never accepted: wait out the timeout, or forever without one
            return await(new Reply<>(), timeout, unit, Boolean.FALSE);
        }

        Reply<Boolean> reply = new Reply<>();
        loop.submit(new SendRequest<>(message, reply));
        if (loop.isTerminated()) {
            Throwable failure = loop.failure();
            if (failure != null) {
                reply.tryFail(failure);
            } else if (loop.isFailFastAfterClose()) {
                reply.tryComplete(Boolean.FALSE);
            }
        }
        return await(reply, timeout, unit, Boolean.FALSE);
    }

    @Override
    public Receipt<T> receive() throws InterruptedException {
        return receive(0, TimeUnit.NANOSECONDS);
    }

    @Override
    public Receipt<T> receive(long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(unit, "Time unit cannot be null");
        if (loop.isTerminated()) {
            checkNotFailed();
            return Receipt.endOfStream();
        }

        Reply<Receipt<T>> reply = new Reply<>();
        loop.submit(new ReceiveRequest<>(reply));
        if (loop.isTerminated()) {
            Throwable failure = loop.failure();
            if (failure != null) {
                reply.tryFail(failure);
            } else {
                reply.tryComplete(Receipt.endOfStream());
            }
        }
        return await(reply, timeout, unit, Receipt.timedOut());
    }

    @Override
    public void close() {
        if (!closeSignalled.compareAndSet(false, true)) {
            logger.debug("Mailbox {} is already closed", name);
            return;
        }
        logger.debug("Closing mailbox {}", name);
        loop.submit(new CloseRequest<>());
    }

    @Override
    public MailboxState state() {
        return loop.state();
    }

    @Override
    public int size() {
        return loop.size();
    }

    /**
     * Returns the name this mailbox was configured with.
     *
     * @return the mailbox name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns storage counters when the mailbox was built over a {@link MeteredStorage}.
     *
     * @return a metrics snapshot, or empty if the storage is not metered
     */
    public Optional<StorageMetrics> metrics() {
        if (storage instanceof MeteredStorage<T> metered) {
            return Optional.of(metered.metrics());
        }
        return Optional.empty();
    }

    /**
     * @return receivers the loop is holding, including withdrawn ones not yet swept
     */
    int waitingReceivers() {
        return loop.waitingReceivers();
    }

    int waitingSenders() {
        return loop.waitingSenders();
    }

    /**
     * Waits for the coordination loop to stop, which happens once the mailbox is closed and
     * drained, or has failed.
     *
     * @param timeout how long to wait
     * @param unit the time unit of the timeout argument
     * @return true if the loop stopped, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return loop.awaitTermination(timeout, unit);
    }

    /**
     * Waits for the reply to a request. On timeout or interrupt the caller tries to withdraw
     * it; if the loop claimed it first, the caller waits for the loop's answer instead.
     */
    private <R> R await(Reply<R> reply, long timeout, TimeUnit unit, R abandoned)
            throws InterruptedException {
        try {
            return timeout > 0 ? reply.future().get(timeout, unit) : reply.future().get();
        } catch (TimeoutException e) {
            if (reply.withdraw()) {
                return abandoned;
            }
            return resolved(reply);
        } catch (InterruptedException e) {
            if (reply.withdraw()) {
                throw e;
            }
            // Already applied: keep the result and the interrupt
            Thread.currentThread().interrupt();
            return resolved(reply);
        } catch (ExecutionException e) {
            throw failed(e.getCause());
        }
    }

    private <R> R resolved(Reply<R> reply) {
        try {
            return reply.future().join();
        } catch (CompletionException e) {
            throw failed(e.getCause());
        }
    }

    private void checkNotFailed() {
        Throwable failure = loop.failure();
        if (failure != null) {
            throw failed(failure);
        }
    }

    private MailboxException failed(Throwable cause) {
        return new MailboxException("Mailbox " + name + " failed", name, cause);
    }

    @Override
    public String toString() {
        return "CoordinatedMailbox{name='" + name + "', state=" + state() + ", size=" + size() + '}';
    }
}
