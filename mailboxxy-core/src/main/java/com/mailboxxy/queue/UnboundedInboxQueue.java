package com.mailboxxy.queue;

import com.mailboxxy.MailboxShutdownException;
import com.mailboxxy.QueueClosedException;
import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded inbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free enqueue; producers never wait
 * - A lock used only while the consumer is parked waiting for a message
 *
 * Producers that passed the closed check but have not yet published their message are
 * counted, so the consumer only reports shutdown once every accepted message is visible.
 *
 * @param <M> The type of messages
 */
public class UnboundedInboxQueue<M> implements InboxQueue<M> {

    private final String name;
    private final MpscUnboundedArrayQueue<M> queue;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final AtomicInteger producersInFlight = new AtomicInteger();
    private volatile boolean hasWaitingConsumer = false;
    private volatile boolean closed = false;

    /**
     * Creates an unbounded inbox with the specified initial chunk size.
     *
     * @param name the mailbox name, used in exception messages
     * @param initialChunkSize the chunk size, rounded up to a power of 2
     */
    public UnboundedInboxQueue(String name, int initialChunkSize) {
        this.name = name;
        // JCTools requires at least 2
        int safeChunkSize = Math.max(2, initialChunkSize);
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(safeChunkSize));
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public void enqueue(M message) {
        Objects.requireNonNull(message, "Message cannot be null");

        producersInFlight.incrementAndGet();
        try {
            if (closed) {
                throw new QueueClosedException("Mailbox '" + name + "' is closed", name);
            }
            queue.offer(message);
        } finally {
            producersInFlight.decrementAndGet();
            signalConsumer();
        }
    }

    @Override
    public boolean enqueue(M message, long timeout, TimeUnit unit) {
        // never full, so the timeout is irrelevant
        enqueue(message);
        return true;
    }

    @Override
    public M dequeue() throws InterruptedException {
        // Fast path: try non-blocking poll first
        M message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                message = pollOrShutdown();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            hasWaitingConsumer = false;
            lock.unlock();
        }
    }

    @Override
    public M poll(long timeout, TimeUnit unit) throws InterruptedException {
        M message = queue.poll();
        if (message != null) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            hasWaitingConsumer = true;
            while (true) {
                message = pollOrShutdown();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            hasWaitingConsumer = false;
            lock.unlock();
        }
    }

    @Override
    public void close() {
        closed = true;
        wakeConsumer();
    }

    @Override
    public List<M> terminate() {
        closed = true;
        // a producer past the closed check publishes before leaving; wait so its message is discarded here
        while (producersInFlight.get() != 0) {
            Thread.onSpinWait();
        }
        List<M> discarded = new ArrayList<>();
        M message;
        while ((message = queue.poll()) != null) {
            discarded.add(message);
        }
        wakeConsumer();
        return discarded;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Polls once; throws if the queue is closed, no producer is mid-enqueue and nothing is left.
     */
    private M pollOrShutdown() {
        M message = queue.poll();
        if (message != null) {
            return message;
        }
        if (closed && producersInFlight.get() == 0) {
            // a producer may have published between the first poll and the counter read
            message = queue.poll();
            if (message != null) {
                return message;
            }
            throw new MailboxShutdownException("Mailbox '" + name + "' is shut down", name);
        }
        return null;
    }

    /**
     * Signals the consumer after an enqueue attempt.
     * Only acquires the lock if the consumer is actually waiting.
     */
    private void signalConsumer() {
        if (hasWaitingConsumer) {
            wakeConsumer();
        }
    }

    private void wakeConsumer() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rounds up to the next power of 2.
     */
    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
