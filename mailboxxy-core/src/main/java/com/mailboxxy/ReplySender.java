package com.mailboxxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The sending half of a reply channel. A message that expects a response embeds one of
 * these; the handler answers with {@link #reply(Object)} exactly once, or gives up with
 * {@link #close()}, which fails the waiting caller with {@link ChannelClosedException}.
 *
 * <p>Example message type:</p>
 * <pre>{@code
 * sealed interface CounterMsg permits Increment, GetValue {}
 * record Increment() implements CounterMsg {}
 * record GetValue(ReplySender<Integer> replyTo) implements CounterMsg {}
 * }</pre>
 *
 * @param <T> the reply value type
 */
public final class ReplySender<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReplySender.class);

    private final CompletableFuture<T> future;
    private final String mailboxName;
    private final AtomicBoolean used = new AtomicBoolean(false);

    ReplySender(CompletableFuture<T> future, String mailboxName) {
        this.future = future;
        this.mailboxName = mailboxName;
    }

    /**
     * Delivers the reply. If the caller already gave up (cancelled, or the mailbox was
     * torn down) the value is discarded.
     *
     * @param value the reply value, may be null
     * @throws IllegalStateException if this sender already replied or was closed
     */
    public void reply(T value) {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("already replied");
        }
        if (!future.complete(value)) {
            logger.debug("Reply from mailbox '{}' discarded, the caller is no longer waiting", mailboxName);
        }
    }

    /**
     * Closes the channel without replying. No-op if a reply was already sent.
     */
    @Override
    public void close() {
        if (used.compareAndSet(false, true)) {
            future.completeExceptionally(
                    new ChannelClosedException("Reply sender closed without a reply", mailboxName));
        }
    }

    /**
     * Returns true once {@link #reply} or {@link #close} has been called.
     */
    public boolean isUsed() {
        return used.get();
    }

    /**
     * Returns true while the asking caller can still receive a reply.
     */
    public boolean isCallerWaiting() {
        return !future.isDone();
    }
}
