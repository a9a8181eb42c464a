package com.mailboxxy;

/**
 * Thrown by {@code post} and {@code ask} when the inbox no longer accepts messages:
 * the mailbox was shut down, its handler exited, or the handle used was released.
 */
public class QueueClosedException extends MailboxException {

    public QueueClosedException(String message) {
        super(message);
    }

    public QueueClosedException(String message, String mailboxName) {
        super(message, null, mailboxName);
    }
}
