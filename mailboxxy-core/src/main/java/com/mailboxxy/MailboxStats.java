package com.mailboxxy;

/**
 * Point-in-time snapshot of a mailbox's counters.
 *
 * @param name the mailbox name
 * @param state the lifecycle state
 * @param queued messages waiting in the inbox
 * @param capacity inbox capacity, Integer.MAX_VALUE if unbounded
 * @param enqueued messages accepted since start
 * @param dequeued messages delivered to the handler since start
 * @param rejected post or ask calls refused because the inbox was closed or the handle released
 * @param pendingReplies asks still waiting for a reply
 * @param liveHandles handles not yet released
 */
public record MailboxStats(
        String name,
        MailboxState state,
        int queued,
        int capacity,
        long enqueued,
        long dequeued,
        long rejected,
        int pendingReplies,
        int liveHandles) {

    /**
     * Returns queued/capacity, or 0.0 for an unbounded inbox.
     */
    public double fillRatio() {
        if (capacity == Integer.MAX_VALUE) {
            return 0.0;
        }
        return (double) queued / capacity;
    }
}
