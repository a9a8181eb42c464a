package com.mailboxxy;

import com.mailboxxy.queue.InboxQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * Runs one handler over one inbox and owns everything shared between the worker and
 * the handles: the queue, outstanding replies, the live-handle count and the lifecycle.
 *
 * <p>When the handler exits for any reason the mailbox terminates: the queue closes and
 * drops what is left, every outstanding reply fails with {@link ChannelClosedException},
 * and the termination future completes.</p>
 *
 * @param <M> The type of messages in the mailbox
 */
final class MailboxProcessor<M> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private final String name;
    private final InboxQueue<M> queue;
    private final MailboxHandler<M> handler;
    private final WorkerContext context = new WorkerContext();
    private final AtomicReference<MailboxState> state = new AtomicReference<>(MailboxState.RUNNING);
    private final AtomicInteger liveHandles = new AtomicInteger(1);
    private final Set<CompletableFuture<?>> pendingReplies = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private final LongAdder enqueued = new LongAdder();
    private final LongAdder dequeued = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    MailboxProcessor(String name, InboxQueue<M> queue, MailboxHandler<M> handler) {
        this.name = name;
        this.queue = queue;
        this.handler = handler;
    }

    /**
     * Submits the worker to the executor.
     *
     * @throws MailboxException if the executor rejects the worker; the mailbox is terminated
     */
    void start(Executor executor) {
        logger.info("Starting mailbox {} (capacity={})", name,
                queue.capacity() == Integer.MAX_VALUE ? "unbounded" : queue.capacity());
        try {
            executor.execute(this::run);
        } catch (RejectedExecutionException e) {
            terminate(e);
            throw new MailboxException("Executor rejected the worker of mailbox '" + name + "'", e, name);
        }
    }

    private void run() {
        logger.debug("Mailbox {} worker started on {}", name, Thread.currentThread().getName());
        Throwable failure = null;
        try {
            handler.handle(context);
            logger.debug("Mailbox {} handler returned", name);
        } catch (MailboxShutdownException e) {
            logger.debug("Mailbox {} drained after shutdown", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Mailbox {} worker interrupted", name);
        } catch (Throwable t) {
            failure = t;
            logger.error("Handler of mailbox {} failed", name, t);
        } finally {
            terminate(failure);
        }
    }

    private void terminate(Throwable failure) {
        if (state.getAndSet(MailboxState.TERMINATED) == MailboxState.TERMINATED) {
            return;
        }
        List<M> discarded = queue.terminate();
        if (!discarded.isEmpty()) {
            logger.warn("Mailbox {} terminated with {} unprocessed message(s), discarding them",
                    name, discarded.size());
        }
        failPendingReplies();
        if (failure == null) {
            termination.complete(null);
        } else {
            termination.completeExceptionally(
                    new MailboxException("Handler of mailbox '" + name + "' failed", failure, name));
        }
        logger.debug("Mailbox {} terminated", name);
    }

    private void failPendingReplies() {
        for (CompletableFuture<?> pending : pendingReplies) {
            pending.completeExceptionally(
                    new ChannelClosedException("Mailbox '" + name + "' terminated before replying", name));
        }
    }

    /**
     * Closes the inbox to new messages. The handler still receives what is queued.
     */
    void shutdown() {
        if (state.compareAndSet(MailboxState.RUNNING, MailboxState.SHUTTING_DOWN)) {
            logger.info("Shutting down mailbox {} ({} message(s) left to drain)", name, queue.size());
            queue.close();
        }
    }

    void post(M message) {
        try {
            queue.enqueue(message);
            enqueued.increment();
        } catch (QueueClosedException e) {
            rejected.increment();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailboxException("Interrupted while waiting for space in mailbox '" + name + "'", e, name);
        }
    }

    boolean post(M message, Duration timeout) {
        try {
            boolean added = queue.enqueue(message, timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (added) {
                enqueued.increment();
            }
            return added;
        } catch (QueueClosedException e) {
            rejected.increment();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailboxException("Interrupted while waiting for space in mailbox '" + name + "'", e, name);
        }
    }

    <T> Reply<T> ask(Function<ReplySender<T>, ? extends M> messageFactory) {
        ReplyChannel<T> channel = ReplyChannel.open(name);
        CompletableFuture<T> future = channel.future();
        // tracked before enqueueing so that a concurrent termination either sees it or rejects the enqueue
        pendingReplies.add(future);
        future.whenComplete((value, error) -> pendingReplies.remove(future));
        try {
            M message = Objects.requireNonNull(messageFactory.apply(channel.sender()),
                    "ask message factory returned null");
            post(message);
        } catch (RuntimeException e) {
            pendingReplies.remove(future);
            future.cancel(false);
            throw e;
        }
        return channel.receiver();
    }

    void recordRejected() {
        rejected.increment();
    }

    void retainHandle() {
        liveHandles.incrementAndGet();
    }

    void releaseHandle() {
        if (liveHandles.decrementAndGet() == 0) {
            logger.debug("Last handle of mailbox {} released", name);
            shutdown();
        }
    }

    String name() {
        return name;
    }

    MailboxState state() {
        return state.get();
    }

    CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    MailboxStats stats() {
        return new MailboxStats(
                name,
                state.get(),
                queue.size(),
                queue.capacity(),
                enqueued.sum(),
                dequeued.sum(),
                rejected.sum(),
                pendingReplies.size(),
                liveHandles.get());
    }

    private final class WorkerContext implements MailboxContext<M> {
        private final AtomicBoolean consuming = new AtomicBoolean(false);

        @Override
        public M dequeue() throws InterruptedException {
            enterConsumer();
            try {
                M message = queue.dequeue();
                dequeued.increment();
                return message;
            } finally {
                consuming.set(false);
            }
        }

        @Override
        public Optional<M> dequeue(Duration timeout) throws InterruptedException {
            enterConsumer();
            try {
                M message = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
                if (message == null) {
                    return Optional.empty();
                }
                dequeued.increment();
                return Optional.of(message);
            } finally {
                consuming.set(false);
            }
        }

        @Override
        public boolean isShutdownRequested() {
            return queue.isClosed();
        }

        @Override
        public String mailboxName() {
            return name;
        }

        private void enterConsumer() {
            if (!consuming.compareAndSet(false, true)) {
                throw new IllegalStateException("Mailbox '" + name + "' is already being dequeued by another thread");
            }
        }
    }
}
