package com.courier.config;

import com.courier.storage.ArrayDequeStorage;
import com.courier.storage.BoundedStorage;
import com.courier.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storage creation strategy for bounded mailboxes.
 * Caps an ArrayDequeStorage at the configured max capacity so senders get backpressure.
 *
 * @param <M> The message type
 */
public class BoundedStorageStrategy<M> implements StorageCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedStorageStrategy.class);

    @Override
    public Storage<M> createStorage(MailboxConfig config) {
        int capacity = config.getMaxCapacity();
        int initialCapacity = Math.min(config.getInitialCapacity(), capacity);
        logger.debug("Creating BoundedStorage for mailbox {} with capacity: {}", config.getName(), capacity);
        return new BoundedStorage<>(new ArrayDequeStorage<>(initialCapacity), capacity);
    }
}
