package com.mailboxxy;

/**
 * Thrown while waiting on a {@link Reply} when the reply channel closed without a value,
 * either because the handler closed the {@link ReplySender} or because the mailbox died
 * before replying.
 */
public class ChannelClosedException extends MailboxException {

    public ChannelClosedException(String message) {
        super(message);
    }

    public ChannelClosedException(String message, String mailboxName) {
        super(message, null, mailboxName);
    }
}
