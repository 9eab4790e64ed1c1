package mailbox.jobs.app.service;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.dto.ApprovalResponse;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.exception.ApprovalConflictException;
import mailbox.jobs.app.exception.IllegalJobStateException;
import mailbox.jobs.app.exception.JobNotFoundException;
import mailbox.jobs.app.payload.ApprovalPayload;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.store.JobStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The human approval gate between a triage preview and its execution.
 *
 * <p>Recording the approval and moving the job to approved happen in one transaction, so the
 * scheduler never sees an approved job without its approval payload.</p>
 */
@Slf4j
@Service
public class ApprovalService {
    static final String UNKNOWN_APPROVER = "unknown";

    private final JobStore store;
    private final JobPayloadCodec codec;
    private final TransactionOperations transactions;

    public ApprovalService(JobStore store, JobPayloadCodec codec, TransactionOperations transactions) {
        this.store = store;
        this.codec = codec;
        this.transactions = transactions;
    }

    /**
     * @throws JobNotFoundException if the job does not exist
     * @throws ApprovalConflictException if the job was already approved
     * @throws IllegalJobStateException if the job is not a completed proposal job
     */
    public ApprovalResponse approve(String jobId, ApprovalPayload request, String approvedBy) {
        request.validate();
        String approver = approvedBy == null || approvedBy.isBlank() ? UNKNOWN_APPROVER : approvedBy;

        ApprovalResponse response = transactions.execute(status -> {
            MailboxJob job = store.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (!job.getKind().isProposal()) {
                throw new IllegalJobStateException("Jobs of kind " + job.getKind().getValue() + " cannot be approved");
            }
            if (job.hasApproval()) {
                throw new ApprovalConflictException(jobId);
            }
            if (job.getStatus() != JobStatus.COMPLETED) {
                throw new IllegalJobStateException("Job must be in 'completed' status to approve (current: "
                    + job.getStatus().getValue() + ")");
            }
            if (job.isCancelRequested()) {
                // the execution phase would stop before its first mutation
                throw new IllegalJobStateException("Job " + jobId + " was cancelled and cannot be approved");
            }

            if (!store.recordApproval(jobId, approver, codec.encode(request))) {
                throw new ApprovalConflictException(jobId);
            }
            if (!store.markApproved(jobId)) {
                throw new IllegalJobStateException("Job " + jobId + " changed status while being approved");
            }
            int rejected = store.decideOthers(jobId, request.getCandidateIds(), JobCandidate.DECISION_REJECTED);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("candidate_ids", request.getCandidateIds());
            data.put("actions", request.getActions());
            data.put("rejected", rejected);
            store.appendEvent(jobId, EventLevel.INFO,
                "Approved by " + approver + ": " + request.getCandidateIds().size() + " candidates", data);

            return new ApprovalResponse(true, jobId, JobStatus.APPROVED.getValue(), request.getCandidateIds().size());
        });
        log.info("Job {} approved by {} with {} candidates", jobId, approver, request.getCandidateIds().size());
        return response;
    }
}
