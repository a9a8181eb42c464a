package com.mailboxxy;

/**
 * Signalled to the handler by {@link MailboxContext#dequeue()} once the inbox is closed
 * and every queued message has been delivered. Handlers normally let it propagate; the
 * runtime treats it as a graceful stop.
 */
public class MailboxShutdownException extends MailboxException {

    public MailboxShutdownException(String message) {
        super(message);
    }

    public MailboxShutdownException(String message, String mailboxName) {
        super(message, null, mailboxName);
    }
}
