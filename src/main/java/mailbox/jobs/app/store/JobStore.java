package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobApproval;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.entity.JobEvent;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for jobs, their event log, their candidates and their approval.
 * Implementations must guarantee that a job is handed to at most one claimer.
 */
public interface JobStore {

    /**
     * Inserts a pending job.
     * @param payloadJson validated kind-specific payload, may be null
     * @return the new job id
     */
    String createJob(JobKind kind, String payloadJson);

    Optional<MailboxJob> getJob(String jobId);

    /**
     * Atomically takes the oldest pending job of the kind, moving it to running.
     * Jobs locked by a concurrent claimer are skipped.
     */
    Optional<MailboxJob> claimNext(JobKind kind);

    /**
     * Same contract as {@link #claimNext(JobKind)} over approved jobs ordered by approval time,
     * moving the claimed job to executing.
     */
    Optional<MailboxJob> claimNextApproved(JobKind kind);

    /**
     * Sets the cancel flag on a pending, running or executing job.
     * @return whether the flag was set; false for unknown or already finished jobs
     */
    boolean requestCancel(String jobId);

    boolean isCancelRequested(String jobId);

    /**
     * Moves a running or executing job to a terminal status and stamps the finish time.
     * Calling it again with the status the job already has is a no-op that returns true.
     * @return false when the transition is not allowed from the job's current status
     */
    boolean markFinished(String jobId, JobStatus status, String error);

    /** Partial update; either argument may be null. */
    void updateProgress(String jobId, Integer processed, Integer totalEstimate);

    /**
     * Stores the approval once.
     * @return false when the job already carries an approval (or does not exist)
     */
    boolean recordApproval(String jobId, String approvedBy, String approvalPayloadJson);

    Optional<JobApproval> getApproval(String jobId);

    /**
     * Moves a completed or pending job to approved.
     * @return false when the job is in any other status
     */
    boolean markApproved(String jobId);

    /** Running or executing jobs whose heartbeat is older than the cutoff. */
    List<MailboxJob> findStaleJobs(Instant heartbeatBefore);

    long appendEvent(String jobId, EventLevel level, String message, Map<String, Object> data);

    default long appendEvent(String jobId, String message) {
        return appendEvent(jobId, EventLevel.INFO, message, Map.of());
    }

    /** Events with an id greater than {@code afterId}, in id order. */
    List<JobEvent> listEvents(String jobId, long afterId, int limit);

    long insertCandidate(JobCandidate candidate);

    /**
     * Candidates of a job ordered by descending confidence.
     * @param minConfidence optional lower bound (inclusive)
     * @param category optional exact category filter
     */
    List<JobCandidate> listCandidates(String jobId, Double minConfidence, String category, int limit);

    /** Subset of the given ids that still exist for the job, ordered by descending confidence. */
    List<JobCandidate> findCandidates(String jobId, Collection<Long> candidateIds);

    void setCandidateDecision(long candidateId, String decision);

    /**
     * Sets the decision on every undecided candidate of the job except the given ones.
     * @return number of candidates updated
     */
    int decideOthers(String jobId, Collection<Long> keepIds, String decision);
}
