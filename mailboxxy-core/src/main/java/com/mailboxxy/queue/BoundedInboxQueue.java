package com.mailboxxy.queue;

import com.mailboxxy.MailboxShutdownException;
import com.mailboxxy.QueueClosedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded inbox: an array deque guarded by a single lock with notEmpty/notFull conditions.
 * Producers that find the queue full park until the consumer frees a slot or the queue
 * closes. With a fair lock, parked producers are admitted roughly in arrival order.
 *
 * @param <M> The type of messages
 */
public class BoundedInboxQueue<M> implements InboxQueue<M> {

    private final String name;
    private final int capacity;
    private final ArrayDeque<M> items;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final Condition notFull;
    private volatile boolean closed = false;

    /**
     * Creates a bounded inbox.
     *
     * @param name the mailbox name, used in exception messages
     * @param capacity the maximum number of queued messages
     * @param fair whether waiting producers are admitted in arrival order
     */
    public BoundedInboxQueue(String name, int capacity, boolean fair) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 1024));
        this.lock = new ReentrantLock(fair);
        this.notEmpty = lock.newCondition();
        this.notFull = lock.newCondition();
    }

    @Override
    public void enqueue(M message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() == capacity) {
                notFull.await();
            }
            insert(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean enqueue(M message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() == capacity) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            insert(message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public M dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed) {
                    throw shutdown();
                }
                notEmpty.await();
            }
            return extract();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public M poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed) {
                    throw shutdown();
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return extract();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<M> terminate() {
        lock.lock();
        try {
            closed = true;
            List<M> discarded = new ArrayList<>(items);
            items.clear();
            notEmpty.signalAll();
            notFull.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    // Caller holds the lock
    private void insert(M message) {
        if (closed) {
            throw new QueueClosedException("Mailbox '" + name + "' is closed", name);
        }
        items.addLast(message);
        notEmpty.signal();
    }

    // Caller holds the lock
    private M extract() {
        M message = items.pollFirst();
        notFull.signal();
        return message;
    }

    private MailboxShutdownException shutdown() {
        return new MailboxShutdownException("Mailbox '" + name + "' is shut down", name);
    }
}
