package mailbox.jobs.app.handler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.config.MailboxProperties;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.mailbox.MailboxClient;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.MessagePage;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.payload.SyncPayload;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.scheduler.JobHandler;
import mailbox.jobs.app.store.MessageCache;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mirrors remote folders into the local message cache.
 */
@Slf4j
public class MailboxSyncHandler implements JobHandler {
    private final JobPayloadCodec codec;
    private final MailboxConnectionPool pool;
    private final MessageCache cache;
    private final MailboxProperties properties;

    public MailboxSyncHandler(JobPayloadCodec codec, MailboxConnectionPool pool, MessageCache cache,
                              MailboxProperties properties) {
        this.codec = codec;
        this.pool = pool;
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public void handle(JobContext context) throws Exception {
        SyncPayload payload = codec.decode(context.getPayload(), SyncPayload.class);
        List<String> folders = payload.getFolders() == null || payload.getFolders().isEmpty()
            ? properties.getSyncFolders()
            : payload.getFolders();

        int synced = 0;
        try (MailboxConnectionPool.Lease lease = pool.acquire()) {
            MailboxClient client = lease.client();
            for (String folder : folders) {
                Set<String> present = new HashSet<>();
                String pageToken = null;
                MessagePage page;
                do {
                    if (context.isCancelRequested()) {
                        context.event("Job cancelled by user while syncing " + folder);
                        return;
                    }
                    page = client.listMessages(folder, pageToken, properties.getSyncPageSize());
                    for (MailMessage message : page.getMessages()) {
                        cache.upsert(message);
                        present.add(message.getUid());
                    }
                    synced += page.getMessages().size();
                    context.progress(synced, null);
                    pageToken = page.getNextPageToken();
                } while (page.hasNext());

                int removed = cache.retainOnly(folder, present);
                log.info("Job {}: synced {} messages in {}, removed {} stale", context.getJobId(), present.size(), folder, removed);
                context.event(EventLevel.INFO, "Synced " + folder + ": " + present.size() + " messages",
                    Map.of("folder", folder, "messages", present.size(), "removed", removed));
            }
        }
        context.event("Sync complete: " + synced + " messages in " + folders.size() + " folders");
    }
}
