package com.mailboxxy.config;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the worker threads that run mailbox handlers started without an executor.
 * Each such mailbox gets one dedicated thread, held for as long as the handler runs.
 *
 * <p>To share threads between mailboxes, pass an {@link java.util.concurrent.Executor}
 * to {@code Mailboxes.start}. A waiting handler holds its thread while it waits in
 * {@code dequeue}, so a shared pool needs a thread per mailbox running at the same time.</p>
 */
public class ThreadPoolFactory {
    // Default values
    private static final boolean DEFAULT_USE_NAMED_THREADS = true;
    private static final boolean DEFAULT_DAEMON_THREADS = true;

    private boolean useNamedThreads = DEFAULT_USE_NAMED_THREADS;
    private boolean daemonThreads = DEFAULT_DAEMON_THREADS;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates a thread factory for a mailbox's dedicated worker thread.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory
     */
    public ThreadFactory createThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = useNamedThreads
                        ? new Thread(r, prefix + "-" + threadNumber.getAndIncrement())
                        : new Thread(r);
                thread.setDaemon(daemonThreads);
                return thread;
            }
        };
    }

    // Getters and setters

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}
