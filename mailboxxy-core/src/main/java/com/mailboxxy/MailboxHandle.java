package com.mailboxxy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The caller-side reference to a mailbox. Safe to share between threads as is;
 * {@link #duplicate()} hands out additional counted references.
 *
 * <p>Every handle counts toward the mailbox's live handles. Releasing a handle with
 * {@link #close()} gives up that reference; once the last one is released the mailbox
 * shuts down the same way {@link #shutdown()} does. Asks already made through other
 * handles are not affected by releasing this one.</p>
 *
 * <pre>{@code
 * MailboxHandle<CounterMsg> counter = Mailboxes.start(counterHandler);
 * counter.post(new Increment());
 * Reply<Integer> value = counter.ask(GetValue::new);
 * int current = value.get();
 * }</pre>
 *
 * @param <M> The message type
 */
public final class MailboxHandle<M> implements AutoCloseable {

    private final MailboxProcessor<M> processor;
    private final AtomicBoolean released = new AtomicBoolean(false);

    MailboxHandle(MailboxProcessor<M> processor) {
        this.processor = processor;
    }

    /**
     * Enqueues a message without waiting for it to be handled.
     * Waits for space if the inbox is bounded and full.
     *
     * @param message the message, not null
     * @throws QueueClosedException if the mailbox no longer accepts messages or this handle was released
     * @throws MailboxException if interrupted while waiting for space
     */
    public void post(M message) {
        ensureLiveForSend();
        processor.post(message);
    }

    /**
     * Enqueues a message, waiting at most {@code timeout} for space in a bounded inbox.
     *
     * @param message the message, not null
     * @param timeout the maximum time to wait for space
     * @return true if enqueued, false if the inbox stayed full
     * @throws QueueClosedException if the mailbox no longer accepts messages or this handle was released
     */
    public boolean post(M message, Duration timeout) {
        ensureLiveForSend();
        return processor.post(message, timeout);
    }

    /**
     * Sends a message that carries a reply sender and returns the pending reply.
     *
     * <p>The factory receives a fresh {@link ReplySender} and builds the message around
     * it, typically a record constructor reference such as {@code GetValue::new}. The
     * returned reply resolves to the handler's answer, or fails with
     * {@link ChannelClosedException} if the sender is closed or the mailbox dies first.</p>
     *
     * @param messageFactory builds the message from the reply sender
     * @param <T> the reply value type
     * @return the pending reply
     * @throws QueueClosedException if the mailbox no longer accepts messages or this handle was released
     */
    public <T> Reply<T> ask(Function<ReplySender<T>, ? extends M> messageFactory) {
        ensureLiveForSend();
        return processor.ask(messageFactory);
    }

    /**
     * Returns a new handle to the same mailbox, counted as an additional live handle.
     *
     * @throws QueueClosedException if this handle was released
     */
    public MailboxHandle<M> duplicate() {
        ensureLive();
        processor.retainHandle();
        return new MailboxHandle<>(processor);
    }

    /**
     * Releases this handle. Idempotent. The mailbox shuts down when its last handle is released.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            processor.releaseHandle();
        }
    }

    /**
     * Stops the mailbox from accepting messages, through any handle. Messages already
     * queued are still delivered to the handler; after the last one, its
     * {@code dequeue} signals shutdown.
     */
    public void shutdown() {
        processor.shutdown();
    }

    /**
     * Waits for the handler to exit.
     *
     * @param timeout the maximum time to wait
     * @return true if the mailbox terminated, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            processor.terminationFuture().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            // terminated by a handler failure
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * Returns a future completing when the handler exits; exceptionally, with a
     * {@link MailboxException}, if the handler threw.
     */
    public CompletableFuture<Void> terminationFuture() {
        return processor.terminationFuture().copy();
    }

    public boolean isShutdown() {
        return processor.state() != MailboxState.RUNNING;
    }

    public boolean isTerminated() {
        return processor.state() == MailboxState.TERMINATED;
    }

    public boolean isReleased() {
        return released.get();
    }

    public String name() {
        return processor.name();
    }

    public MailboxStats stats() {
        return processor.stats();
    }

    @Override
    public String toString() {
        return "MailboxHandle{" + processor.name() + ", state=" + processor.state() + '}';
    }

    private void ensureLive() {
        if (released.get()) {
            throw releasedHandle();
        }
    }

    // refused sends count as rejected, like sends to a closed inbox
    private void ensureLiveForSend() {
        if (released.get()) {
            processor.recordRejected();
            throw releasedHandle();
        }
    }

    private QueueClosedException releasedHandle() {
        return new QueueClosedException(
                "Handle for mailbox '" + processor.name() + "' has been released", processor.name());
    }
}
