package com.mailboxxy;

/**
 * Base exception for failures raised by the mailbox runtime.
 * Carries the name of the mailbox involved, when known.
 */
public class MailboxException extends RuntimeException {

    /** The name of the mailbox where the failure occurred. */
    private final String mailboxName;

    /**
     * Creates a new MailboxException with the specified detail message.
     *
     * @param message the detail message
     */
    public MailboxException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a new MailboxException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public MailboxException(String message, Throwable cause) {
        this(message, cause, null);
    }

    /**
     * Creates a new MailboxException with the specified detail message, cause, and mailbox name.
     *
     * @param message the detail message
     * @param cause the cause of the exception, may be null
     * @param mailboxName the name of the mailbox, may be null
     */
    public MailboxException(String message, Throwable cause, String mailboxName) {
        super(message, cause);
        this.mailboxName = mailboxName;
    }

    /**
     * Returns the name of the mailbox where the failure occurred.
     *
     * @return the mailbox name, or null if not specified
     */
    public String getMailboxName() {
        return mailboxName;
    }
}
