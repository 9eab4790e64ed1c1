package mailbox.jobs.app.handler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.config.TriageProperties;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.mailbox.JournaledMailboxMutator;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.payload.BulkCleanupPayload;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.scheduler.JobHandler;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Moves a producer-supplied list of messages to a cleanup folder, optionally marking them read first.
 */
@Slf4j
public class BulkCleanupHandler implements JobHandler {
    private final JobPayloadCodec codec;
    private final MailboxConnectionPool pool;
    private final MutationJournal journal;
    private final MessageCache cache;
    private final BatchRunner batchRunner;
    private final int progressEventEveryBatches;
    private final TriageProperties triageProperties;

    public BulkCleanupHandler(JobPayloadCodec codec, MailboxConnectionPool pool, MutationJournal journal,
                              MessageCache cache, BatchRunner batchRunner, int progressEventEveryBatches,
                              TriageProperties triageProperties) {
        this.codec = codec;
        this.pool = pool;
        this.journal = journal;
        this.cache = cache;
        this.batchRunner = batchRunner;
        this.progressEventEveryBatches = Math.max(1, progressEventEveryBatches);
        this.triageProperties = triageProperties;
    }

    @Override
    public void handle(JobContext context) {
        BulkCleanupPayload payload = codec.decode(context.getPayload(), BulkCleanupPayload.class);
        String destination = payload.getDestination() != null
            ? payload.getDestination()
            : triageProperties.getCleanupDestination();
        boolean markRead = payload.getMarkRead() == null || payload.getMarkRead();

        List<MailItemRef> targets = payload.getUids() == null ? List.of() : payload.getUids().stream()
            .map(target -> MailItemRef.of(target.getUid(), target.getFolder() != null ? target.getFolder() : "INBOX"))
            .collect(Collectors.toList());
        context.progress(0, targets.size());
        if (targets.isEmpty()) {
            context.event("No UIDs in payload");
            return;
        }

        BatchRunner.BatchResult result;
        try (MailboxConnectionPool.Lease lease = pool.acquire()) {
            JournaledMailboxMutator mutator = new JournaledMailboxMutator(lease.client(), journal, cache);
            result = batchRunner.run(context, targets,
                item -> {
                    if (markRead) {
                        mutator.markRead(item);
                    }
                    mutator.move(item, destination);
                },
                (chunkNumber, chunk, total) -> {
                    if (chunkNumber % progressEventEveryBatches == 0) {
                        context.event("Progress: " + total.getProcessed() + " moved, " + total.getFailed() + " failed");
                    }
                });
        }

        if (result.isCancelled()) {
            return;
        }
        log.info("Job {}: cleanup to {} done, {} moved, {} failed", context.getJobId(), destination,
            result.getProcessed(), result.getFailed());
        context.event(EventLevel.INFO,
            "Cleanup complete: " + result.getProcessed() + " moved, " + result.getFailed() + " failed",
            Map.of("moved", result.getProcessed(), "failed", result.getFailed(), "destination", destination));
    }
}
