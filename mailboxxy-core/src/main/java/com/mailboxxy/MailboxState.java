package com.mailboxxy;

/**
 * Lifecycle of a mailbox. Transitions only move forward.
 */
public enum MailboxState {
    /** Accepting and delivering messages. */
    RUNNING,
    /** Shutdown requested: no new messages, queued ones are still delivered. */
    SHUTTING_DOWN,
    /** The handler has exited; nothing is accepted or delivered. */
    TERMINATED
}
