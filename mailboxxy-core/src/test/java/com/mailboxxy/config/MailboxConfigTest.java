package com.mailboxxy.config;

import com.mailboxxy.queue.BoundedInboxQueue;
import com.mailboxxy.queue.InboxQueue;
import com.mailboxxy.queue.UnboundedInboxQueue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MailboxConfig and MailboxBounds.
 */
class MailboxConfigTest {

    @Test
    void testDefaultConfiguration() {
        MailboxConfig config = new MailboxConfig();

        assertFalse(config.isBounded(), "Inbox should be unbounded by default");
        assertEquals(Integer.MAX_VALUE, config.getBounds().capacity());
        assertNull(config.getName());
        assertEquals(MailboxConfig.DEFAULT_INITIAL_CHUNK_SIZE, config.getInitialChunkSize());
        assertTrue(config.isFairProducers());
        assertNotNull(config.getThreadPoolFactory());
    }

    @Test
    void testFluentSetters() {
        ThreadPoolFactory factory = new ThreadPoolFactory().setDaemonThreads(false);
        MailboxConfig config = new MailboxConfig()
                .setCapacity(16)
                .setName("inventory")
                .setInitialChunkSize(64)
                .setFairProducers(false)
                .setThreadPoolFactory(factory);

        assertTrue(config.isBounded());
        assertEquals(new MailboxBounds.Bounded(16), config.getBounds());
        assertEquals("inventory", config.getName());
        assertEquals(64, config.getInitialChunkSize());
        assertFalse(config.isFairProducers());
        assertSame(factory, config.getThreadPoolFactory());
    }

    @Test
    void testBoundsRejectZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> MailboxBounds.bounded(0));
        assertThrows(IllegalArgumentException.class, () -> MailboxConfig.bounded(-3));
    }

    @Test
    void testGeneratedNamesAreUnique() {
        MailboxConfig config = new MailboxConfig();
        String first = config.resolveName();
        String second = config.resolveName();

        assertTrue(first.startsWith(MailboxConfig.DEFAULT_NAME_PREFIX + "-"));
        assertNotEquals(first, second);
        assertEquals("fixed", config.setName("fixed").resolveName());
    }

    @Test
    void testBlankNameFallsBackToGenerated() {
        String name = new MailboxConfig().setName("  ").resolveName();
        assertTrue(name.startsWith(MailboxConfig.DEFAULT_NAME_PREFIX + "-"), name);
    }

    @Test
    void testValidateRejectsTinyChunks() {
        MailboxConfig config = new MailboxConfig().setInitialChunkSize(1);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
        assertTrue(e.getMessage().contains("chunk"));
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> new MailboxConfig().setBounds(null));
        assertThrows(NullPointerException.class, () -> new MailboxConfig().setThreadPoolFactory(null));
    }

    @Test
    void testQueueMatchesBounds() {
        InboxQueue<String> unbounded = InboxQueue.create(MailboxConfig.unbounded(), "u");
        InboxQueue<String> bounded = InboxQueue.create(MailboxConfig.bounded(5), "b");

        assertInstanceOf(UnboundedInboxQueue.class, unbounded);
        assertInstanceOf(BoundedInboxQueue.class, bounded);
        assertEquals(5, bounded.capacity());
        assertEquals(Integer.MAX_VALUE, unbounded.capacity());
    }
}
