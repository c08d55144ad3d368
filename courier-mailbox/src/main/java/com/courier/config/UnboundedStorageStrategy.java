package com.courier.config;

import com.courier.storage.ArrayDequeStorage;
import com.courier.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storage creation strategy for unbounded mailboxes.
 * Uses ArrayDequeStorage presized to the configured initial capacity.
 *
 * @param <M> The message type
 */
public class UnboundedStorageStrategy<M> implements StorageCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(UnboundedStorageStrategy.class);

    @Override
    public Storage<M> createStorage(MailboxConfig config) {
        int initialCapacity = config.getInitialCapacity();
        logger.debug("Creating ArrayDequeStorage for mailbox {} with initial capacity: {}",
                config.getName(), initialCapacity);
        return new ArrayDequeStorage<>(initialCapacity);
    }
}
