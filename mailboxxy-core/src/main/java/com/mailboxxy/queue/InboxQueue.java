package com.mailboxxy.queue;

import com.mailboxxy.MailboxShutdownException;
import com.mailboxxy.QueueClosedException;
import com.mailboxxy.config.MailboxConfig;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Multi-producer/single-consumer message queue feeding one mailbox handler.
 *
 * <p>Any number of threads may enqueue concurrently. Exactly one thread at a time may
 * call {@link #dequeue()}, {@link #poll(long, TimeUnit)} or {@link #terminate()}; the
 * queue relies on this to keep the consumer side simple. Messages from one producer are
 * dequeued in the order that producer enqueued them.</p>
 *
 * <p>Closing is one-way. After {@link #close()} every enqueue fails with
 * {@link QueueClosedException}, while messages already accepted stay available to the
 * consumer. Once they are drained, dequeue signals {@link MailboxShutdownException}.</p>
 *
 * @param <M> The type of messages
 */
public interface InboxQueue<M> {

    /**
     * Appends the message, waiting for space if the queue is bounded and full.
     *
     * @param message the message to add
     * @throws QueueClosedException if the queue is closed, including while waiting
     * @throws InterruptedException if interrupted while waiting for space
     */
    void enqueue(M message) throws InterruptedException;

    /**
     * Appends the message, waiting up to the given time for space.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if added, false if the queue stayed full for the whole timeout
     * @throws QueueClosedException if the queue is closed, including while waiting
     * @throws InterruptedException if interrupted while waiting for space
     */
    boolean enqueue(M message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes and returns the head, waiting until a message is available.
     *
     * @return the head of this queue
     * @throws MailboxShutdownException if the queue is closed and empty
     * @throws InterruptedException if interrupted while waiting
     */
    M dequeue() throws InterruptedException;

    /**
     * Removes and returns the head, waiting up to the given time.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this queue, or null if the timeout elapsed
     * @throws MailboxShutdownException if the queue is closed and empty
     * @throws InterruptedException if interrupted while waiting
     */
    M poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Stops accepting messages. Queued messages remain available to the consumer.
     * Wakes the consumer and any producer waiting for space.
     */
    void close();

    /**
     * Closes the queue and discards everything still queued.
     *
     * @return the discarded messages, in queue order
     */
    List<M> terminate();

    boolean isClosed();

    /**
     * Returns the number of queued messages.
     */
    int size();

    /**
     * Returns the maximum number of queued messages, or Integer.MAX_VALUE if unbounded.
     */
    int capacity();

    /**
     * Creates the queue described by the configuration.
     *
     * @param config the mailbox configuration
     * @param mailboxName name used in exception messages
     * @param <M> the message type
     * @return a new, open queue
     */
    static <M> InboxQueue<M> create(MailboxConfig config, String mailboxName) {
        if (config.isBounded()) {
            return new BoundedInboxQueue<>(mailboxName, config.getBounds().capacity(), config.isFairProducers());
        }
        return new UnboundedInboxQueue<>(mailboxName, config.getInitialChunkSize());
    }
}
