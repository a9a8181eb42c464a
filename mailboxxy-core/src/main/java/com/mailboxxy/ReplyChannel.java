package com.mailboxxy;

import java.util.concurrent.CompletableFuture;

/**
 * A one-shot channel carrying a single value from a handler back to one waiting caller.
 * {@link MailboxHandle#ask} opens one per call; it can also be opened directly when a
 * handler forwards work to another mailbox.
 *
 * @param <T> the reply value type
 */
public final class ReplyChannel<T> {

    private final CompletableFuture<T> future;
    private final ReplySender<T> sender;
    private final Reply<T> receiver;

    private ReplyChannel(String mailboxName) {
        this.future = new CompletableFuture<>();
        this.sender = new ReplySender<>(future, mailboxName);
        this.receiver = new PendingReply<>(future);
    }

    public static <T> ReplyChannel<T> open() {
        return new ReplyChannel<>(null);
    }

    static <T> ReplyChannel<T> open(String mailboxName) {
        return new ReplyChannel<>(mailboxName);
    }

    public ReplySender<T> sender() {
        return sender;
    }

    public Reply<T> receiver() {
        return receiver;
    }

    CompletableFuture<T> future() {
        return future;
    }
}
