package com.mailboxxy;

import java.time.Duration;
import java.util.Optional;

/**
 * The worker-side view of a mailbox, handed only to its {@link MailboxHandler}.
 * It is the sole consumer of the inbox; calling {@link #dequeue()} from two threads at
 * once is rejected.
 *
 * @param <M> The message type
 */
public interface MailboxContext<M> {

    /**
     * Waits for the next message.
     *
     * @return the next message
     * @throws MailboxShutdownException once the mailbox is shut down and every queued message was delivered
     * @throws InterruptedException if the worker thread is interrupted while waiting
     */
    M dequeue() throws InterruptedException;

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @param timeout the maximum time to wait
     * @return the next message, or empty if none arrived in time
     * @throws MailboxShutdownException once the mailbox is shut down and every queued message was delivered
     * @throws InterruptedException if the worker thread is interrupted while waiting
     */
    Optional<M> dequeue(Duration timeout) throws InterruptedException;

    /**
     * Returns true once shutdown was requested. Queued messages may still be waiting.
     */
    boolean isShutdownRequested();

    String mailboxName();
}
