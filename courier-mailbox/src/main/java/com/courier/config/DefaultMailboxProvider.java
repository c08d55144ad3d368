package com.courier.config;

import com.courier.mailbox.CoordinatedMailbox;
import com.courier.storage.MeteredStorage;
import com.courier.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default mailbox provider that builds coordinated mailboxes, choosing the storage
 * backend by {@link StorageType} using the Strategy pattern.
 *
 * <ul>
 *   <li>UNBOUNDED: ArrayDequeStorage</li>
 *   <li>BOUNDED: BoundedStorage over an ArrayDequeStorage</li>
 * </ul>
 *
 * Metered configurations get a MeteredStorage wrapped around the chosen backend.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<StorageType, StorageCreationStrategy<M>> strategies;
    private final StorageCreationStrategy<M> defaultStrategy;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(StorageType.class);
        this.strategies.put(StorageType.UNBOUNDED, new UnboundedStorageStrategy<>());
        this.strategies.put(StorageType.BOUNDED, new BoundedStorageStrategy<>());
        this.defaultStrategy = new UnboundedStorageStrategy<>();
    }

    /**
     * Replaces the strategy used for a storage type.
     *
     * @param storageType The storage type
     * @param strategy The strategy to use for it
     * @return This provider
     */
    public DefaultMailboxProvider<M> withStrategy(StorageType storageType, StorageCreationStrategy<M> strategy) {
        strategies.put(Objects.requireNonNull(storageType, "Storage type cannot be null"),
                Objects.requireNonNull(strategy, "Strategy cannot be null"));
        return this;
    }

    @Override
    public CoordinatedMailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = ((config != null) ? config : new MailboxConfig()).validate();

        logger.debug("DefaultMailboxProvider creating mailbox - config: {}", effectiveConfig);

        StorageCreationStrategy<M> strategy = strategies.getOrDefault(effectiveConfig.getStorageType(), defaultStrategy);
        Storage<M> storage = strategy.createStorage(effectiveConfig);
        if (effectiveConfig.isMetered()) {
            storage = new MeteredStorage<>(storage);
        }
        return new CoordinatedMailbox<>(storage, effectiveConfig);
    }
}
