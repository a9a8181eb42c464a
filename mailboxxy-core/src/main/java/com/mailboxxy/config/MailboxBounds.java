package com.mailboxxy.config;

/**
 * Capacity of a mailbox inbox, fixed at creation.
 */
public sealed interface MailboxBounds permits MailboxBounds.Unbounded, MailboxBounds.Bounded {

    /**
     * No capacity limit: {@code post} never waits. Memory grows with the backlog.
     */
    record Unbounded() implements MailboxBounds {
        @Override
        public int capacity() {
            return Integer.MAX_VALUE;
        }
    }

    /**
     * At most {@code capacity} queued messages: {@code post} waits for space when full.
     */
    record Bounded(int capacity) implements MailboxBounds {
        public Bounded {
            if (capacity < 1) {
                throw new IllegalArgumentException("Bounded capacity must be at least 1, got " + capacity);
            }
        }
    }

    /**
     * Returns the maximum number of queued messages, or Integer.MAX_VALUE if unbounded.
     */
    int capacity();

    static MailboxBounds unbounded() {
        return new Unbounded();
    }

    static MailboxBounds bounded(int capacity) {
        return new Bounded(capacity);
    }
}
