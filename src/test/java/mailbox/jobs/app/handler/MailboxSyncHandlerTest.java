package mailbox.jobs.app.handler;

import mailbox.jobs.app.config.MailboxProperties;
import mailbox.jobs.app.entity.JobEvent;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.mailbox.FakeMailboxClient;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.payload.SyncPayload;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.store.InMemoryJobStore;
import mailbox.jobs.app.store.InMemoryMessageCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MailboxSyncHandlerTest {
    private final JobPayloadCodec codec = new JobPayloadCodec();
    private InMemoryJobStore store;
    private InMemoryMessageCache cache;
    private FakeMailboxClient mailbox;
    private MailboxSyncHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(Clock.systemUTC());
        cache = new InMemoryMessageCache();
        mailbox = new FakeMailboxClient();
        MailboxProperties properties = new MailboxProperties();
        properties.setSyncPageSize(2);
        handler = new MailboxSyncHandler(codec,
            new MailboxConnectionPool(List.of(mailbox), Duration.ofSeconds(1)), cache, properties);
    }

    @Test
    void handle_ShouldPageThroughFolderAndDropVanishedMessages() throws Exception {
        // Given
        for (int i = 1; i <= 5; i++) {
            mailbox.add("u" + i, "INBOX", i % 2 == 0);
        }
        cache.upsert(MailMessage.builder().uid("gone").folder("INBOX").unread(true)
            .date(Instant.parse("2023-01-01T00:00:00Z")).build());
        JobContext context = claim(null);

        // When
        handler.handle(context);

        // Then
        assertEquals(5, cache.count("INBOX"));
        assertEquals(2, cache.findUnread("INBOX", 10).size());
        List<String> messages = messages(context.getJobId());
        assertTrue(messages.contains("Synced INBOX: 5 messages"));
        assertEquals("Sync complete: 5 messages in 1 folders", messages.get(messages.size() - 1));
        assertEquals(5, store.getJob(context.getJobId()).orElseThrow().getProcessed());
    }

    @Test
    void handle_WithExplicitFolders_ShouldSyncEachOfThem() throws Exception {
        // Given
        mailbox.add("a", "INBOX", true).add("b", "Work", true);
        JobContext context = claim(new SyncPayload(List.of("INBOX", "Work")));

        // When
        handler.handle(context);

        // Then
        assertEquals(1, cache.count("INBOX"));
        assertEquals(1, cache.count("Work"));
        assertTrue(messages(context.getJobId()).contains("Sync complete: 2 messages in 2 folders"));
    }

    @Test
    void handle_WhenCancelled_ShouldStopBeforeListing() throws Exception {
        // Given
        mailbox.add("a", "INBOX", true);
        JobContext context = claim(null);
        store.requestCancel(context.getJobId());

        // When
        handler.handle(context);

        // Then
        assertEquals(0, cache.count("INBOX"));
        assertEquals(List.of("Job cancelled by user while syncing INBOX"), messages(context.getJobId()));
    }

    private JobContext claim(SyncPayload payload) {
        store.createJob(JobKind.MAILBOX_SYNC, payload == null ? null : codec.encode(payload));
        return new JobContext(store.claimNext(JobKind.MAILBOX_SYNC).orElseThrow(), store);
    }

    private List<String> messages(String jobId) {
        return store.listEvents(jobId, 0, 100).stream().map(JobEvent::getMessage).collect(Collectors.toList());
    }
}
