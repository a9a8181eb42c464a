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
import java.util.Optional;
import java.util.function.IntConsumer;

/**
 * A handler that does timed work between messages: it emits a tick whenever its inbox
 * stays quiet for one interval, and ends itself when asked to stop.
 */
public class TickerExample {
    private static final Logger logger = LoggerFactory.getLogger(TickerExample.class);

    public sealed interface TickerMsg {

        record GetTicks(ReplySender<Integer> replyTo) implements TickerMsg {
        }

        /** Ends the handler; the reply carries the final tick count. */
        record Stop(ReplySender<Integer> replyTo) implements TickerMsg {
        }
    }

    private final Duration interval;
    private final IntConsumer onTick;

    public TickerExample(Duration interval, IntConsumer onTick) {
        this.interval = interval;
        this.onTick = onTick;
    }

    public void run(MailboxContext<TickerMsg> ctx) throws InterruptedException {
        int ticks = 0;
        while (true) {
            Optional<TickerMsg> next = ctx.dequeue(interval);
            if (next.isEmpty()) {
                ticks++;
                onTick.accept(ticks);
                continue;
            }
            TickerMsg msg = next.get();
            if (msg instanceof TickerMsg.GetTicks get) {
                get.replyTo().reply(ticks);
            } else if (msg instanceof TickerMsg.Stop stop) {
                logger.debug("Ticker {} stopping after {} ticks", ctx.mailboxName(), ticks);
                stop.replyTo().reply(ticks);
                return;
            }
        }
    }

    public MailboxHandle<TickerMsg> start(String name) {
        return Mailboxes.start(this::run, new MailboxConfig().setName(name));
    }

    public static void main(String[] args) throws Exception {
        TickerExample ticker = new TickerExample(Duration.ofMillis(100),
                tick -> logger.info("tick {}", tick));
        MailboxHandle<TickerMsg> handle = ticker.start("ticker");

        Thread.sleep(550);
        Reply<Integer> soFar = handle.ask(TickerMsg.GetTicks::new);
        logger.info("Ticks so far: {}", soFar.get());

        Reply<Integer> last = handle.ask(TickerMsg.Stop::new);
        logger.info("Stopped after {} ticks", last.get(Duration.ofSeconds(5)));
        handle.awaitTermination(Duration.ofSeconds(5));
    }
}
