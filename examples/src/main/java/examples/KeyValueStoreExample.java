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
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An in-memory key/value store behind a bounded mailbox. Writers that outpace the store
 * wait in {@code post} instead of growing the queue.
 */
public class KeyValueStoreExample {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueStoreExample.class);

    public static final int INBOX_CAPACITY = 64;

    public sealed interface StoreMsg {

        /** Stores a value and replies with the previous one, if any. */
        record Put(String key, String value, ReplySender<Optional<String>> replyTo) implements StoreMsg {
        }

        /** Stores a value without a reply. */
        record PutQuietly(String key, String value) implements StoreMsg {
        }

        record Get(String key, ReplySender<Optional<String>> replyTo) implements StoreMsg {
        }

        record Remove(String key, ReplySender<Boolean> replyTo) implements StoreMsg {
        }

        record Size(ReplySender<Integer> replyTo) implements StoreMsg {
        }
    }

    public static void store(MailboxContext<StoreMsg> ctx) throws InterruptedException {
        Map<String, String> entries = new HashMap<>();
        while (true) {
            StoreMsg msg = ctx.dequeue();
            if (msg instanceof StoreMsg.Put put) {
                put.replyTo().reply(Optional.ofNullable(entries.put(put.key(), put.value())));
            } else if (msg instanceof StoreMsg.PutQuietly put) {
                entries.put(put.key(), put.value());
            } else if (msg instanceof StoreMsg.Get get) {
                get.replyTo().reply(Optional.ofNullable(entries.get(get.key())));
            } else if (msg instanceof StoreMsg.Remove remove) {
                remove.replyTo().reply(entries.remove(remove.key()) != null);
            } else if (msg instanceof StoreMsg.Size size) {
                size.replyTo().reply(entries.size());
            }
        }
    }

    public static MailboxHandle<StoreMsg> start() {
        return Mailboxes.start(KeyValueStoreExample::store,
                MailboxConfig.bounded(INBOX_CAPACITY).setName("kv-store"));
    }

    public static void main(String[] args) throws Exception {
        MailboxHandle<StoreMsg> store = start();
        try {
            for (int i = 0; i < 10_000; i++) {
                store.post(new StoreMsg.PutQuietly("key-" + (i % 100), "value-" + i));
            }

            Reply<Optional<String>> previous = store.ask(replyTo -> new StoreMsg.Put("key-7", "replaced", replyTo));
            logger.info("key-7 was {}", previous.get().orElse("<absent>"));

            Reply<Optional<String>> current = store.ask(replyTo -> new StoreMsg.Get("key-7", replyTo));
            logger.info("key-7 is now {}", current.get().orElse("<absent>"));

            Reply<Boolean> removed = store.ask(replyTo -> new StoreMsg.Remove("key-8", replyTo));
            Reply<Integer> size = store.ask(StoreMsg.Size::new);
            logger.info("Removed key-8: {}, {} entries left", removed.get(), size.get(Duration.ofSeconds(5)));
        } finally {
            store.close();
            store.awaitTermination(Duration.ofSeconds(5));
        }
    }
}
