package com.courier.mailbox;

/**
 * Lifecycle states of a mailbox.
 *
 * <pre>
 * ┌────────┐  close()   ┌──────────┐  storage empty  ┌────────┐
 * │  OPEN  │───────────▶│ DRAINING │────────────────▶│ CLOSED │
 * └────────┘            └──────────┘                 └────────┘
 *      │                                                 ▲
 *      └──────────── close() with nothing buffered ──────┘
 * </pre>
 *
 * <p>From a receiver's point of view {@link #OPEN} and {@link #DRAINING} look the same:
 * buffered messages are delivered either way.
 */
public enum MailboxState {

    /** Accepting sends and delivering buffered messages. */
    OPEN(true, true),

    /** Close was signalled; buffered messages are still delivered. */
    DRAINING(false, true),

    /** Terminal. Nothing is buffered and every receive reports end-of-stream. */
    CLOSED(false, false);

    private final boolean acceptingSends;
    private final boolean delivering;

    MailboxState(boolean acceptingSends, boolean delivering) {
        this.acceptingSends = acceptingSends;
        this.delivering = delivering;
    }

    /**
     * @return true if sends can still be accepted in this state
     */
    public boolean isAcceptingSends() {
        return acceptingSends;
    }

    /**
     * @return true if receives can still be served with messages in this state
     */
    public boolean isDelivering() {
        return delivering;
    }

    /**
     * @return true if this is the terminal state
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }
}
