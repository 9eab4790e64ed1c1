package mailbox.jobs.app.handler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.mailbox.JournaledMailboxMutator;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.ConfidenceBucket;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.TriageAction;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.payload.TriageApplyPayload;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.scheduler.JobHandler;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies classifier results without a review step: labels always, read/archive only for
 * high-confidence items when auto-apply is on.
 */
@Slf4j
public class TriageApplyHandler implements JobHandler {
    private final JobPayloadCodec codec;
    private final MailboxConnectionPool pool;
    private final MutationJournal journal;
    private final MessageCache cache;
    private final BatchRunner batchRunner;
    private final int progressEventEveryBatches;
    private final String archiveFolder;

    public TriageApplyHandler(JobPayloadCodec codec, MailboxConnectionPool pool, MutationJournal journal,
                              MessageCache cache, BatchRunner batchRunner, int progressEventEveryBatches,
                              String archiveFolder) {
        this.codec = codec;
        this.pool = pool;
        this.journal = journal;
        this.cache = cache;
        this.batchRunner = batchRunner;
        this.progressEventEveryBatches = Math.max(1, progressEventEveryBatches);
        this.archiveFolder = archiveFolder;
    }

    private static class Tally {
        int labelsAdded;
        int labelsRemoved;
        int markedRead;
        int archived;
    }

    @Override
    public void handle(JobContext context) {
        TriageApplyPayload payload = codec.decode(context.getPayload(), TriageApplyPayload.class);
        List<TriageApplyPayload.Item> items = payload.getItems() == null ? List.of() : payload.getItems();
        boolean autoApply = payload.autoApply();
        context.progress(0, items.size());
        if (items.isEmpty()) {
            context.event("No items in payload");
            return;
        }

        Tally tally = new Tally();
        BatchRunner.BatchResult result;
        try (MailboxConnectionPool.Lease lease = pool.acquire()) {
            JournaledMailboxMutator mutator = new JournaledMailboxMutator(lease.client(), journal, cache);
            result = batchRunner.run(context, items,
                item -> applyItem(context, mutator, item, autoApply, tally),
                (chunkNumber, chunk, total) -> {
                    if (chunkNumber % progressEventEveryBatches == 0) {
                        context.event("Progress: " + total.getProcessed() + " of " + items.size() + " items");
                    }
                });
        }

        if (result.isCancelled()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("labels_added", tally.labelsAdded);
        data.put("labels_removed", tally.labelsRemoved);
        data.put("marked_read", tally.markedRead);
        data.put("archived", tally.archived);
        data.put("failed", result.getFailed());
        context.event(EventLevel.INFO, String.format(
            "Triage apply complete: +%d labels, -%d labels, %d read, %d archived, %d failed",
            tally.labelsAdded, tally.labelsRemoved, tally.markedRead, tally.archived, result.getFailed()), data);
    }

    private void applyItem(JobContext context, JournaledMailboxMutator mutator, TriageApplyPayload.Item item,
                           boolean autoApply, Tally tally) {
        MailItemRef ref = MailItemRef.of(item.getUid(), item.getFolder() != null ? item.getFolder() : "INBOX");

        if (item.getRemoveLabel() != null && !item.getRemoveLabel().isBlank()) {
            try {
                mutator.removeLabels(ref, List.of(item.getRemoveLabel()));
                tally.labelsRemoved++;
            } catch (Exception e) {
                log.warn("Job {}: could not remove label {} from {}: {}",
                    context.getJobId(), item.getRemoveLabel(), ref.getUid(), e.getMessage());
            }
        }
        if (item.getLabel() != null && !item.getLabel().isBlank()) {
            try {
                mutator.addLabels(ref, List.of(item.getLabel()));
                tally.labelsAdded++;
            } catch (Exception e) {
                log.warn("Job {}: could not add label {} to {}: {}",
                    context.getJobId(), item.getLabel(), ref.getUid(), e.getMessage());
            }
        }

        double confidence = item.getConfidence() == null ? 0.0 : item.getConfidence();
        if (!autoApply || ConfidenceBucket.of(confidence) != ConfidenceBucket.HIGH || item.getActions() == null) {
            return;
        }
        // read before archive: the archived item may no longer be addressable in its folder
        if (item.getActions().contains(TriageAction.MARK_READ.getValue())) {
            try {
                mutator.markRead(ref);
                tally.markedRead++;
            } catch (Exception e) {
                log.warn("Job {}: could not mark {} read: {}", context.getJobId(), ref.getUid(), e.getMessage());
            }
        }
        if (item.getActions().contains(TriageAction.ARCHIVE.getValue())) {
            try {
                mutator.move(ref, archiveFolder);
                tally.archived++;
            } catch (Exception e) {
                log.warn("Job {}: could not archive {}: {}", context.getJobId(), ref.getUid(), e.getMessage());
            }
        }
    }
}
