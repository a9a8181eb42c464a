package com.mailboxxy;

/**
 * Unchecked exception thrown when waiting for a reply fails for a reason other than
 * the channel closing, such as interruption or cancellation.
 */
public class ReplyException extends MailboxException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
