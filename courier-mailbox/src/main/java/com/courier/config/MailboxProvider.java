package com.courier.config;

import com.courier.mailbox.Mailbox;

/**
 * An interface for providing mailboxes.
 * Implementations decide which storage backs a mailbox based on its configuration.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox based on the provided configuration. The returned mailbox is
     * already running.
     *
     * @param config The mailbox configuration, or null for defaults
     * @return A new {@link Mailbox} instance
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
