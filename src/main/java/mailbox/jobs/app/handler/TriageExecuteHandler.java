package mailbox.jobs.app.handler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.classifier.TriageCategory;
import mailbox.jobs.app.config.TriageProperties;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobApproval;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.exception.IllegalJobStateException;
import mailbox.jobs.app.mailbox.JournaledMailboxMutator;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.TriageAction;
import mailbox.jobs.app.payload.ApprovalPayload;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.scheduler.JobHandler;
import mailbox.jobs.app.store.JobStore;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Execution phase of an approved triage preview: applies the approved actions to the approved
 * candidates and records a decision on each of them.
 */
@Slf4j
public class TriageExecuteHandler implements JobHandler {
    private final JobPayloadCodec codec;
    private final MailboxConnectionPool pool;
    private final MutationJournal journal;
    private final MessageCache cache;
    private final BatchRunner batchRunner;
    private final TriageProperties triageProperties;
    private final String archiveFolder;

    public TriageExecuteHandler(JobPayloadCodec codec, MailboxConnectionPool pool, MutationJournal journal,
                                MessageCache cache, BatchRunner batchRunner, TriageProperties triageProperties,
                                String archiveFolder) {
        this.codec = codec;
        this.pool = pool;
        this.journal = journal;
        this.cache = cache;
        this.batchRunner = batchRunner;
        this.triageProperties = triageProperties;
        this.archiveFolder = archiveFolder;
    }

    @Override
    public void handle(JobContext context) {
        JobStore store = context.getStore();
        String jobId = context.getJobId();

        JobApproval approval = store.getApproval(jobId)
            .filter(a -> a.getApprovedAt() != null)
            .orElseThrow(() -> new IllegalJobStateException("Cannot execute triage job without approval"));
        ApprovalPayload approved = codec.decode(approval.getApprovalPayload(), ApprovalPayload.class);

        Set<Long> requestedIds = new LinkedHashSet<>(
            approved.getCandidateIds() == null ? List.of() : approved.getCandidateIds());
        Set<TriageAction> actions = EnumSet.noneOf(TriageAction.class);
        if (approved.getActions() != null) {
            approved.getActions().forEach(action -> actions.add(TriageAction.fromValue(action)));
        }

        List<JobCandidate> candidates = store.findCandidates(jobId, requestedIds);
        int missing = requestedIds.size() - candidates.size();
        if (missing > 0) {
            context.event(EventLevel.WARN, "Skipped " + missing + " candidate ids not found for this job",
                Map.of("missing", missing));
        }
        context.progress(0, candidates.size());
        if (candidates.isEmpty() || actions.isEmpty()) {
            context.event("Nothing to execute: " + candidates.size() + " candidates, " + actions.size() + " actions");
            return;
        }

        BatchRunner.BatchResult result;
        try (MailboxConnectionPool.Lease lease = pool.acquire()) {
            JournaledMailboxMutator mutator = new JournaledMailboxMutator(lease.client(), journal, cache);
            result = batchRunner.run(context, candidates,
                candidate -> execute(store, mutator, candidate, actions),
                (chunkNumber, chunk, total) -> context.event(
                    "Processed batch " + chunkNumber + ": " + chunk.getProcessed() + " done, " + chunk.getFailed() + " failed"));
        }

        if (result.isCancelled()) {
            return;
        }
        log.info("Job {}: executed {} candidates, {} failed", jobId, result.getProcessed(), result.getFailed());
        context.event(EventLevel.INFO,
            "Triage execution complete: " + result.getProcessed() + " executed, " + result.getFailed() + " failed",
            Map.of("executed", result.getProcessed(), "failed", result.getFailed()));
    }

    private void execute(JobStore store, JournaledMailboxMutator mutator, JobCandidate candidate,
                         Set<TriageAction> actions) throws Exception {
        MailItemRef ref = MailItemRef.of(candidate.getUid(), candidate.getFolder());
        try {
            if (actions.contains(TriageAction.ADD_LABEL)) {
                mutator.addLabels(ref, List.of(TriageCategory.labelFor(triageProperties.getLabelPrefix(), candidate.getCategory())));
            }
            if (actions.contains(TriageAction.MARK_READ)) {
                mutator.markRead(ref);
            }
            if (actions.contains(TriageAction.ARCHIVE)) {
                mutator.move(ref, archiveFolder);
            }
        } catch (Exception e) {
            store.setCandidateDecision(candidate.getId(), JobCandidate.DECISION_ERROR_PREFIX + e.getMessage());
            throw e;
        }
        store.setCandidateDecision(candidate.getId(), JobCandidate.DECISION_EXECUTED);
    }
}
