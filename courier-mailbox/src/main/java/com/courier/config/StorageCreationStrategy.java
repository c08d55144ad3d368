package com.courier.config;

import com.courier.storage.Storage;

/**
 * Strategy interface for creating mailbox storage from configuration.
 * This allows different storage backends to be plugged in without modifying
 * the mailbox provider logic.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface StorageCreationStrategy<M> {

    /**
     * Creates a storage according to this strategy.
     *
     * @param config The mailbox configuration
     * @return A new, empty storage instance
     */
    Storage<M> createStorage(MailboxConfig config);
}
