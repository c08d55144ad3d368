package com.courier.config;

/**
 * Kinds of storage a mailbox can be built on.
 */
public enum StorageType {
    /**
     * Grows without limit. Senders are accepted as soon as the mailbox sees them.
     */
    UNBOUNDED,

    /**
     * Holds at most {@link MailboxConfig#getMaxCapacity()} messages.
     * Senders wait while it is full.
     */
    BOUNDED
}
