package com.courier.config;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Configuration for a coordinated mailbox.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final String DEFAULT_NAME = "mailbox";
    public static final StorageType DEFAULT_STORAGE_TYPE = StorageType.UNBOUNDED;
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    public static final int DEFAULT_MAX_CAPACITY = 10_000;
    public static final boolean DEFAULT_METERED = false;
    public static final boolean DEFAULT_DAEMON = true;
    public static final boolean DEFAULT_FAIL_FAST_AFTER_CLOSE = false;

    private String name;
    private StorageType storageType;
    private int initialCapacity;
    private int maxCapacity;
    private boolean metered;
    private boolean daemon;
    private boolean failFastAfterClose;
    private ThreadFactory threadFactory;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.name = DEFAULT_NAME;
        this.storageType = DEFAULT_STORAGE_TYPE;
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
        this.maxCapacity = DEFAULT_MAX_CAPACITY;
        this.metered = DEFAULT_METERED;
        this.daemon = DEFAULT_DAEMON;
        this.failFastAfterClose = DEFAULT_FAIL_FAST_AFTER_CLOSE;
    }

    /**
     * Sets the mailbox name, used in logs, exceptions and coordination thread names.
     *
     * @param name The mailbox name
     * @return This MailboxConfig instance
     */
    public MailboxConfig setName(String name) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets the kind of storage the mailbox is built on.
     *
     * @param storageType The storage type
     * @return This MailboxConfig instance
     */
    public MailboxConfig setStorageType(StorageType storageType) {
        this.storageType = Objects.requireNonNull(storageType, "Storage type cannot be null");
        return this;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    /**
     * Sets the initial capacity of the storage. This is a sizing hint; unbounded storage
     * grows past it.
     *
     * @param initialCapacity The initial capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Sets the maximum number of buffered messages for {@link StorageType#BOUNDED} storage.
     * Ignored for unbounded storage.
     *
     * @param maxCapacity The maximum capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMaxCapacity(int maxCapacity) {
        this.maxCapacity = maxCapacity;
        return this;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    /**
     * Enables counting of appended and dropped messages.
     *
     * @param metered true to wrap the storage in a metering decorator
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMetered(boolean metered) {
        this.metered = metered;
        return this;
    }

    public boolean isMetered() {
        return metered;
    }

    /**
     * Sets whether the default coordination thread is a daemon thread.
     * Ignored when a custom thread factory is set.
     *
     * @param daemon true for daemon threads
     * @return This MailboxConfig instance
     */
    public MailboxConfig setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    /**
     * Makes sends issued after close return false right away instead of waiting for their
     * timeout (or forever, without one).
     *
     * @param failFastAfterClose true to reject sends after close immediately
     * @return This MailboxConfig instance
     */
    public MailboxConfig setFailFastAfterClose(boolean failFastAfterClose) {
        this.failFastAfterClose = failFastAfterClose;
        return this;
    }

    public boolean isFailFastAfterClose() {
        return failFastAfterClose;
    }

    /**
     * Sets the factory that creates the coordination thread.
     *
     * @param threadFactory The thread factory, or null for the default
     * @return This MailboxConfig instance
     */
    public MailboxConfig setThreadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    public ThreadFactory getThreadFactory() {
        return threadFactory;
    }

    /**
     * Returns the configured thread factory, or a {@link MailboxThreadFactory} named after
     * this mailbox.
     *
     * @return the factory for the coordination thread
     */
    public ThreadFactory resolveThreadFactory() {
        if (threadFactory != null) {
            return threadFactory;
        }
        return new MailboxThreadFactory("courier-" + name, daemon);
    }

    /**
     * Checks that the configured values can be used to build a mailbox.
     *
     * @return This MailboxConfig instance
     * @throws IllegalArgumentException if a value is out of range
     */
    public MailboxConfig validate() {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity cannot be negative: " + initialCapacity);
        }
        if (storageType == StorageType.BOUNDED && maxCapacity <= 0) {
            throw new IllegalArgumentException("Bounded storage needs a positive max capacity: " + maxCapacity);
        }
        return this;
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
                "name='" + name + '\'' +
                ", storageType=" + storageType +
                ", initialCapacity=" + initialCapacity +
                ", maxCapacity=" + maxCapacity +
                ", metered=" + metered +
                ", daemon=" + daemon +
                ", failFastAfterClose=" + failFastAfterClose +
                '}';
    }
}
