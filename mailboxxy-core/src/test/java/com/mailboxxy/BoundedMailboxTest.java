package com.mailboxxy;

import com.mailboxxy.config.MailboxConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Backpressure on bounded inboxes.
 */
@Timeout(10)
class BoundedMailboxTest {

    @Test
    void testPostWaitsForSpaceWhenFull() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        List<String> handled = new ArrayList<>();
        MailboxHandle<String> mailbox = Mailboxes.start(ctx -> {
            gate.await();
            while (true) {
                handled.add(ctx.dequeue());
            }
        }, MailboxConfig.bounded(1).setName("narrow"));

        mailbox.post("first");
        assertEquals(1, mailbox.stats().queued());
        assertEquals(1.0, mailbox.stats().fillRatio());

        CountDownLatch secondSent = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            mailbox.post("second");
            secondSent.countDown();
        });
        producer.start();

        assertFalse(secondSent.await(200, TimeUnit.MILLISECONDS), "post should wait while the inbox is full");

        gate.countDown();
        assertTrue(secondSent.await(5, TimeUnit.SECONDS));
        producer.join(5_000);

        mailbox.shutdown();
        assertTrue(mailbox.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(List.of("first", "second"), handled);
    }

    @Test
    void testTimedPostReturnsFalseWhenStillFull() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<Integer> mailbox = Mailboxes.start(ctx -> {
            gate.await();
            while (true) {
                ctx.dequeue();
            }
        }, MailboxConfig.bounded(2));

        assertTrue(mailbox.post(1, Duration.ofMillis(100)));
        assertTrue(mailbox.post(2, Duration.ofMillis(100)));
        assertFalse(mailbox.post(3, Duration.ofMillis(100)));
        assertEquals(2, mailbox.stats().enqueued());
        assertEquals(0, mailbox.stats().rejected());

        gate.countDown();
        mailbox.shutdown();
        assertTrue(mailbox.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(2, mailbox.stats().dequeued());
    }

    @Test
    void testBlockedProducerIsReleasedWhenHandlerDies() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<String> mailbox = Mailboxes.start(ctx -> {
            gate.await();
        }, MailboxConfig.bounded(1));

        mailbox.post("fills the inbox");

        AtomicReference<Throwable> producerError = new AtomicReference<>();
        CountDownLatch producerDone = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                mailbox.post("never fits");
            } catch (Throwable t) {
                producerError.set(t);
            } finally {
                producerDone.countDown();
            }
        });
        producer.start();
        assertFalse(producerDone.await(100, TimeUnit.MILLISECONDS));

        gate.countDown();

        assertTrue(producerDone.await(5, TimeUnit.SECONDS));
        assertInstanceOf(QueueClosedException.class, producerError.get());
        assertTrue(mailbox.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(0, mailbox.stats().queued());
    }

    @Test
    void testBlockedProducerIsReleasedOnShutdown() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<String> mailbox = Mailboxes.start(ctx -> {
            gate.await();
            while (true) {
                ctx.dequeue();
            }
        }, MailboxConfig.bounded(1));
        mailbox.post("queued");

        AtomicReference<Throwable> producerError = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                mailbox.post("blocked");
            } catch (Throwable t) {
                producerError.set(t);
            }
        });
        producer.start();
        Thread.sleep(100);

        mailbox.shutdown();
        producer.join(5_000);
        assertFalse(producer.isAlive());
        assertInstanceOf(QueueClosedException.class, producerError.get());

        gate.countDown();
        assertTrue(mailbox.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(1, mailbox.stats().dequeued());
    }

    @Test
    void testAskOnFullInboxWaitsThenReplies() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<CounterProtocol.CounterMsg> counter = Mailboxes.start(ctx -> {
            gate.await();
            CounterProtocol.counter(ctx);
        }, MailboxConfig.bounded(1));

        counter.post(new CounterProtocol.Increment());
        AtomicReference<Integer> answer = new AtomicReference<>();
        Thread asker = new Thread(() -> {
            Reply<Integer> reply = counter.ask(CounterProtocol.GetValue::new);
            answer.set(reply.get());
        });
        asker.start();

        Thread.sleep(100);
        assertNull(answer.get());
        assertEquals(1, counter.stats().pendingReplies());

        gate.countDown();
        asker.join(5_000);
        assertEquals(1, answer.get());

        counter.shutdown();
        assertTrue(counter.awaitTermination(Duration.ofSeconds(5)));
    }

    @Test
    void testInterruptedPostThrowsMailboxExceptionAndKeepsFlag() throws InterruptedException {
        assertInterruptedWhileWaitingForSpace(mailbox -> mailbox.post("blocked"));
    }

    @Test
    void testInterruptedTimedPostThrowsMailboxExceptionAndKeepsFlag() throws InterruptedException {
        assertInterruptedWhileWaitingForSpace(mailbox -> mailbox.post("blocked", Duration.ofSeconds(30)));
    }

    @Test
    void testAskAfterShutdownIsRejectedWhileDraining() throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<CounterProtocol.CounterMsg> counter = Mailboxes.start(ctx -> {
            gate.await();
            CounterProtocol.counter(ctx);
        }, MailboxConfig.bounded(4));

        counter.post(new CounterProtocol.Increment());
        counter.post(new CounterProtocol.Increment());
        counter.shutdown();

        assertFalse(counter.isTerminated());
        assertEquals(2, counter.stats().queued());
        assertThrows(QueueClosedException.class, () -> counter.ask(CounterProtocol.GetValue::new));
        assertEquals(0, counter.stats().pendingReplies());

        gate.countDown();
        assertTrue(counter.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(2, counter.stats().dequeued());
        assertEquals(1, counter.stats().rejected());
    }

    private void assertInterruptedWhileWaitingForSpace(Consumer<MailboxHandle<String>> send)
            throws InterruptedException {
        CountDownLatch gate = new CountDownLatch(1);
        MailboxHandle<String> mailbox = Mailboxes.start(ctx -> {
            gate.await();
            while (true) {
                ctx.dequeue();
            }
        }, MailboxConfig.bounded(1).setName("interrupted"));
        mailbox.post("fills the inbox");

        AtomicReference<Throwable> producerError = new AtomicReference<>();
        AtomicBoolean flagAfterFailure = new AtomicBoolean();
        Thread producer = new Thread(() -> {
            try {
                send.accept(mailbox);
            } catch (Throwable t) {
                producerError.set(t);
                flagAfterFailure.set(Thread.currentThread().isInterrupted());
            }
        });
        producer.start();
        Thread.sleep(100);
        assertTrue(producer.isAlive(), "producer should be waiting for space");

        producer.interrupt();
        producer.join(5_000);

        assertFalse(producer.isAlive());
        MailboxException e = assertInstanceOf(MailboxException.class, producerError.get());
        assertEquals("interrupted", e.getMailboxName());
        assertInstanceOf(InterruptedException.class, e.getCause());
        assertTrue(flagAfterFailure.get(), "interrupt flag should be restored");
        assertEquals(1, mailbox.stats().enqueued());

        gate.countDown();
        mailbox.shutdown();
        assertTrue(mailbox.awaitTermination(Duration.ofSeconds(5)));
    }
}
