package examples;

import com.mailboxxy.MailboxHandle;
import com.mailboxxy.test.AskTestHelper;
import com.mailboxxy.test.AsyncAssertion;
import examples.CounterExample.CounterMsg;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CounterExampleTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MailboxHandle<CounterMsg> counter;

    @BeforeEach
    void setUp() {
        counter = CounterExample.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        counter.close();
        counter.awaitTermination(TIMEOUT);
    }

    @Test
    void testIncrementsThenDecrement() {
        counter.post(new CounterMsg.Increment());
        counter.post(new CounterMsg.Increment());
        counter.post(new CounterMsg.Increment());
        AskTestHelper.askAndExpect(counter, CounterMsg.GetValue::new, 3, TIMEOUT);

        counter.post(new CounterMsg.Decrement(1));
        AskTestHelper.askAndExpect(counter, CounterMsg.GetValue::new, 2, TIMEOUT);
    }

    @Test
    void testProducersOnDuplicatedHandles() throws InterruptedException {
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            MailboxHandle<CounterMsg> own = counter.duplicate();
            Thread thread = new Thread(() -> {
                try (own) {
                    for (int n = 0; n < 250; n++) {
                        own.post(new CounterMsg.Increment());
                    }
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join(TIMEOUT.toMillis());
        }

        int value = AskTestHelper.ask(counter, CounterMsg.GetValue::new, TIMEOUT);
        assertEquals(1_000, value);
        assertEquals(1, counter.stats().liveHandles());
    }

    @Test
    void testClosingLastHandleStopsCounter() {
        counter.post(new CounterMsg.Increment());
        counter.close();

        AsyncAssertion.eventually(counter::isTerminated, TIMEOUT);
        assertEquals(1, counter.stats().dequeued());
    }
}
