package com.mailboxxy.config;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Configuration for a mailbox: inbox capacity, a name used for threads and logging,
 * and the thread factory used when no executor is supplied.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final MailboxBounds DEFAULT_BOUNDS = MailboxBounds.unbounded();
    public static final int DEFAULT_INITIAL_CHUNK_SIZE = 128;
    public static final boolean DEFAULT_FAIR_PRODUCERS = true;
    public static final String DEFAULT_NAME_PREFIX = "mailbox";

    private static final AtomicLong NAME_COUNTER = new AtomicLong();

    private MailboxBounds bounds;
    private String name;
    private int initialChunkSize;
    private boolean fairProducers;
    private ThreadPoolFactory threadPoolFactory;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.bounds = DEFAULT_BOUNDS;
        this.name = null;
        this.initialChunkSize = DEFAULT_INITIAL_CHUNK_SIZE;
        this.fairProducers = DEFAULT_FAIR_PRODUCERS;
        this.threadPoolFactory = new ThreadPoolFactory();
    }

    public static MailboxConfig unbounded() {
        return new MailboxConfig().setBounds(MailboxBounds.unbounded());
    }

    public static MailboxConfig bounded(int capacity) {
        return new MailboxConfig().setBounds(MailboxBounds.bounded(capacity));
    }

    /**
     * Sets the inbox capacity.
     *
     * @param bounds unbounded or bounded(n)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setBounds(MailboxBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
        return this;
    }

    /**
     * Shorthand for {@code setBounds(MailboxBounds.bounded(capacity))}.
     *
     * @param capacity the maximum number of queued messages
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        return setBounds(MailboxBounds.bounded(capacity));
    }

    /**
     * Sets the mailbox name, used in thread names, log lines and exceptions.
     * A unique name is generated when none is set.
     *
     * @param name The mailbox name
     * @return This MailboxConfig instance
     */
    public MailboxConfig setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Sets the chunk size of the unbounded queue. Rounded up to a power of two.
     *
     * @param initialChunkSize The chunk size
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialChunkSize(int initialChunkSize) {
        this.initialChunkSize = initialChunkSize;
        return this;
    }

    /**
     * Sets whether producers blocked on a full bounded inbox are admitted in arrival order.
     *
     * @param fairProducers true for FIFO admission
     * @return This MailboxConfig instance
     */
    public MailboxConfig setFairProducers(boolean fairProducers) {
        this.fairProducers = fairProducers;
        return this;
    }

    /**
     * Sets the factory that creates the worker thread when no executor is supplied.
     *
     * @param threadPoolFactory The thread pool factory
     * @return This MailboxConfig instance
     */
    public MailboxConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
        return this;
    }

    public MailboxBounds getBounds() {
        return bounds;
    }

    public boolean isBounded() {
        return bounds instanceof MailboxBounds.Bounded;
    }

    /**
     * Returns the configured name, or null if one will be generated.
     */
    public String getName() {
        return name;
    }

    public int getInitialChunkSize() {
        return initialChunkSize;
    }

    public boolean isFairProducers() {
        return fairProducers;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    /**
     * Returns the configured name, or a generated unique one.
     */
    public String resolveName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return DEFAULT_NAME_PREFIX + "-" + NAME_COUNTER.incrementAndGet();
    }

    /**
     * Checks the configuration before a mailbox is started.
     *
     * @throws IllegalArgumentException if a setting is out of range
     */
    public void validate() {
        if (initialChunkSize < 2) {
            throw new IllegalArgumentException("Initial chunk size must be at least 2, got " + initialChunkSize);
        }
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
                "bounds=" + bounds +
                ", name=" + name +
                ", initialChunkSize=" + initialChunkSize +
                ", fairProducers=" + fairProducers +
                '}';
    }
}
