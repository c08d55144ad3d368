package com.courier.mailbox;

/**
 * Thrown to callers of a mailbox whose coordination loop has failed.
 * A failed mailbox is closed; every later operation throws this exception as well.
 */
public class MailboxException extends RuntimeException {

    /** The name of the mailbox that failed. */
    private final String mailboxName;

    /**
     * Creates a new MailboxException with the specified detail message.
     *
     * @param message the detail message
     */
    public MailboxException(String message) {
        super(message);
        this.mailboxName = null;
    }

    /**
     * Creates a new MailboxException with the specified detail message, mailbox name and cause.
     *
     * @param message the detail message
     * @param mailboxName the name of the mailbox that failed
     * @param cause the failure raised inside the coordination loop
     */
    public MailboxException(String message, String mailboxName, Throwable cause) {
        super(message, cause);
        this.mailboxName = mailboxName;
    }

    /**
     * Gets the name of the mailbox that failed.
     *
     * @return the mailbox name, or null if not known
     */
    public String getMailboxName() {
        return mailboxName;
    }
}
