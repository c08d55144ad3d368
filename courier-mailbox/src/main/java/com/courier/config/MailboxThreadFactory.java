package com.courier.config;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named platform threads for mailbox coordination loops, for better thread
 * identification in logs and profilers.
 */
public class MailboxThreadFactory implements ThreadFactory {

    private final String prefix;
    private final boolean daemon;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    /**
     * @param prefix The prefix for thread names
     * @param daemon Whether created threads are daemon threads
     */
    public MailboxThreadFactory(String prefix, boolean daemon) {
        this.prefix = Objects.requireNonNull(prefix, "Prefix cannot be null");
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
        thread.setDaemon(daemon);
        return thread;
    }
}
