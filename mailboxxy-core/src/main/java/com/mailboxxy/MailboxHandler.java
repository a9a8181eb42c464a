package com.mailboxxy;

/**
 * The behavior of a mailbox, written as an ordinary sequential loop.
 *
 * <p>The runtime calls {@link #handle} exactly once, on the mailbox's worker. State kept
 * in local variables of the handler is owned by it alone and needs no locking:</p>
 * <pre>{@code
 * MailboxHandler<CounterMsg> counter = ctx -> {
 *     int count = 0;
 *     while (true) {
 *         CounterMsg msg = ctx.dequeue();
 *         if (msg instanceof Increment) {
 *             count++;
 *         } else if (msg instanceof GetValue get) {
 *             get.replyTo().reply(count);
 *         }
 *     }
 * };
 * }</pre>
 *
 * <p>The handler must keep returning to {@link MailboxContext#dequeue()}; one that stops
 * doing so starves every caller, and the runtime does not detect it. Returning from
 * {@code handle}, or throwing, ends the mailbox for good.</p>
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxHandler<M> {

    /**
     * Runs the mailbox's message loop.
     *
     * @param context the worker-side view of the inbox
     * @throws Exception any failure; it terminates the mailbox and is logged
     */
    void handle(MailboxContext<M> context) throws Exception;
}
