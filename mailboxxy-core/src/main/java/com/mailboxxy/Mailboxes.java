package com.mailboxxy;

import com.mailboxxy.config.MailboxConfig;
import com.mailboxxy.queue.InboxQueue;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;

/**
 * Entry point: starts a handler on its own mailbox and returns the first handle to it.
 *
 * <p>Each mailbox is owned by whoever holds its handles; there is no registry.</p>
 */
public final class Mailboxes {

    private Mailboxes() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Starts a mailbox with an unbounded inbox on a dedicated thread.
     *
     * @param handler the message loop
     * @param <M> the message type
     * @return the first handle to the mailbox
     */
    public static <M> MailboxHandle<M> start(MailboxHandler<M> handler) {
        return start(handler, new MailboxConfig());
    }

    /**
     * Starts a mailbox on a dedicated thread created by the config's thread pool factory.
     *
     * @param handler the message loop
     * @param config inbox bounds, name and thread settings
     * @param <M> the message type
     * @return the first handle to the mailbox
     */
    public static <M> MailboxHandle<M> start(MailboxHandler<M> handler, MailboxConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        String name = config.resolveName();
        ThreadFactory threadFactory = config.getThreadPoolFactory().createThreadFactory(name);
        return launch(handler, config, name, runnable -> threadFactory.newThread(runnable).start());
    }

    /**
     * Starts a mailbox whose worker runs on the given executor. The worker holds an
     * executor thread for the mailbox's whole lifetime.
     *
     * @param handler the message loop
     * @param config inbox bounds and name
     * @param executor runs the worker
     * @param <M> the message type
     * @return the first handle to the mailbox
     * @throws MailboxException if the executor rejects the worker
     */
    public static <M> MailboxHandle<M> start(MailboxHandler<M> handler, MailboxConfig config, Executor executor) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        return launch(handler, config, config.resolveName(), executor);
    }

    private static <M> MailboxHandle<M> launch(
            MailboxHandler<M> handler, MailboxConfig config, String name, Executor executor) {
        Objects.requireNonNull(handler, "handler cannot be null");
        config.validate();
        InboxQueue<M> queue = InboxQueue.create(config, name);
        MailboxProcessor<M> processor = new MailboxProcessor<>(name, queue, handler);
        MailboxHandle<M> handle = new MailboxHandle<>(processor);
        processor.start(executor);
        return handle;
    }
}
