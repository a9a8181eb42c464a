package examples;

import com.mailboxxy.MailboxContext;
import com.mailboxxy.MailboxHandle;
import com.mailboxxy.Mailboxes;
import com.mailboxxy.Reply;
import com.mailboxxy.ReplySender;
import com.mailboxxy.config.MailboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A counter owned by a mailbox, updated from several threads without any locking in
 * user code.
 */
public class CounterExample {
    private static final Logger logger = LoggerFactory.getLogger(CounterExample.class);

    public sealed interface CounterMsg {

        record Increment() implements CounterMsg {
        }

        record Decrement(int amount) implements CounterMsg {
        }

        record GetValue(ReplySender<Integer> replyTo) implements CounterMsg {
        }
    }

    /**
     * The counter's message loop. Runs until the mailbox shuts down.
     */
    public static void counter(MailboxContext<CounterMsg> ctx) throws InterruptedException {
        int count = 0;
        while (true) {
            CounterMsg msg = ctx.dequeue();
            if (msg instanceof CounterMsg.Increment) {
                count++;
            } else if (msg instanceof CounterMsg.Decrement decrement) {
                count -= decrement.amount();
            } else if (msg instanceof CounterMsg.GetValue get) {
                get.replyTo().reply(count);
            }
        }
    }

    public static MailboxHandle<CounterMsg> start() {
        return Mailboxes.start(CounterExample::counter, new MailboxConfig().setName("counter"));
    }

    public static void main(String[] args) throws Exception {
        MailboxHandle<CounterMsg> counter = start();

        int workers = 4;
        int incrementsPerWorker = 1_000;
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            MailboxHandle<CounterMsg> own = counter.duplicate();
            Thread thread = new Thread(() -> {
                try (own) {
                    for (int n = 0; n < incrementsPerWorker; n++) {
                        own.post(new CounterMsg.Increment());
                    }
                }
            }, "producer-" + i);
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        counter.post(new CounterMsg.Decrement(500));
        Reply<Integer> reply = counter.ask(CounterMsg.GetValue::new);
        int value = reply.get(Duration.ofSeconds(5));
        logger.info("Counter value after {} increments and one decrement of 500: {}",
                workers * incrementsPerWorker, value);

        counter.close();
        counter.awaitTermination(Duration.ofSeconds(5));
        logger.info("Counter stats: {}", counter.stats());
    }
}
