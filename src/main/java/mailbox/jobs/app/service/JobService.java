package mailbox.jobs.app.service;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.dto.JobCreatedResponse;
import mailbox.jobs.app.dto.JobSnapshot;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.exception.JobNotFoundException;
import mailbox.jobs.app.payload.JobPayload;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.store.JobStore;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Producer-facing job operations: create, inspect, cancel.
 */
@Slf4j
@Service
public class JobService {
    private final JobStore store;
    private final JobPayloadCodec codec;

    public JobService(JobStore store, JobPayloadCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * Validates the payload against the kind's schema and queues a pending job.
     * @throws mailbox.jobs.app.exception.InvalidJobPayloadException if the payload is malformed
     */
    public JobCreatedResponse createJob(JobKind kind, Map<String, Object> rawPayload) {
        JobPayload payload = codec.parse(kind, rawPayload);
        String jobId = store.createJob(kind, codec.encode(payload));

        int count = payload.itemCount();
        String message = queuedMessage(kind) + (count >= 0 ? ": " + count + " items" : "");
        store.appendEvent(jobId, EventLevel.INFO, message, Map.of("kind", kind.getValue()));
        log.info("Queued {} job {}", kind.getValue(), jobId);

        return new JobCreatedResponse(jobId, JobStatus.PENDING.getValue(), count >= 0 ? count : null);
    }

    public JobSnapshot getJob(String jobId) {
        return store.getJob(jobId)
            .map(JobSnapshot::of)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * @return whether the cancel flag was set; false when the job already finished
     */
    public boolean cancel(String jobId) {
        if (store.getJob(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        boolean requested = store.requestCancel(jobId);
        if (requested) {
            store.appendEvent(jobId, EventLevel.WARN, "Cancellation requested", Map.of());
            log.info("Cancellation requested for job {}", jobId);
        }
        return requested;
    }

    private static String queuedMessage(JobKind kind) {
        switch (kind) {
            case MAILBOX_SYNC:
                return "Sync job queued";
            case TRIAGE_PREVIEW:
                return "Triage preview job queued";
            case BULK_CLEANUP:
                return "Cleanup job queued";
            case TRIAGE_APPLY:
                return "Triage apply job queued";
            default:
                return "Job queued";
        }
    }
}
