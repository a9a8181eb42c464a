package com.mailboxxy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The receiving half of a reply channel, returned by {@link MailboxHandle#ask}.
 * Resolves to exactly one value or one failure. Provides three tiers of API:
 * 1. Simple: get() - waits and returns the value or throws
 * 2. Safe: await() - returns a Result for explicit handling
 * 3. Advanced: future() - the underlying CompletableFuture
 *
 * @param <T> the reply value type
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Waits until the reply is available and returns the value.
     *
     * @throws ChannelClosedException if the channel closed without a reply
     * @throws ReplyException if interrupted or cancelled while waiting
     */
    T get();

    /**
     * Waits until the reply is available or the timeout expires.
     *
     * @throws TimeoutException if the timeout expires before the reply
     * @throws ChannelClosedException if the channel closed without a reply
     */
    T get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Waits until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Waits until the reply is available or the timeout expires.
     * Returns a Failure holding a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check; empty if the reply has not arrived yet.
     */
    Optional<Result<T>> poll();

    boolean isDone();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * Access the underlying CompletableFuture for composition.
     * Cancelling it abandons the reply; a later reply from the handler is discarded.
     */
    CompletableFuture<T> future();

    <U> Reply<U> map(Function<T, U> fn);

    Reply<T> recover(Function<Throwable, T> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     */
    void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure);
}
