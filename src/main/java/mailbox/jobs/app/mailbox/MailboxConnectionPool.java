package mailbox.jobs.app.mailbox;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool of mailbox connections. A worker holds one connection for its whole batch
 * and gives it back when the {@link Lease} is closed, including on exceptions.
 */
@Slf4j
public class MailboxConnectionPool {
    private final BlockingQueue<MailboxClient> idle;
    private final int size;
    private final Duration acquireTimeout;

    public MailboxConnectionPool(List<? extends MailboxClient> connections, Duration acquireTimeout) {
        if (connections.isEmpty()) {
            throw new IllegalArgumentException("Mailbox pool needs at least one connection");
        }
        this.size = connections.size();
        this.idle = new ArrayBlockingQueue<>(size, false, connections);
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Waits up to the acquire timeout for a connection.
     * @throws MailboxPoolExhaustedException if none became free in time
     */
    public Lease acquire() {
        try {
            MailboxClient client = idle.poll(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (client == null) {
                throw new MailboxPoolExhaustedException(
                    "No mailbox connections available in pool after " + acquireTimeout.toSeconds() + "s");
            }
            log.debug("Mailbox connection acquired ({} of {} idle)", idle.size(), size);
            return new Lease(client);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailboxPoolExhaustedException("Interrupted while waiting for a mailbox connection");
        }
    }

    public int available() {
        return idle.size();
    }

    public int size() {
        return size;
    }

    public final class Lease implements AutoCloseable {
        private final MailboxClient client;
        private boolean released;

        private Lease(MailboxClient client) {
            this.client = client;
        }

        public MailboxClient client() {
            if (released) {
                throw new IllegalStateException("Mailbox connection already returned to the pool");
            }
            return client;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                idle.offer(client);
            }
        }
    }
}
