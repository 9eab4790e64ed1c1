package mailbox.jobs.app.store;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.*;
import mailbox.jobs.app.repository.JobCandidateRepository;
import mailbox.jobs.app.repository.JobEventRepository;
import mailbox.jobs.app.repository.MailboxJobRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed store. Claims rely on {@code FOR UPDATE SKIP LOCKED} inside the claiming transaction.
 */
@Slf4j
public class JpaJobStore implements JobStore {
    private final MailboxJobRepository jobRepository;
    private final JobEventRepository eventRepository;
    private final JobCandidateRepository candidateRepository;
    private final Clock clock;

    public JpaJobStore(
            MailboxJobRepository jobRepository,
            JobEventRepository eventRepository,
            JobCandidateRepository candidateRepository,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.eventRepository = eventRepository;
        this.candidateRepository = candidateRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public String createJob(JobKind kind, String payloadJson) {
        MailboxJob job = MailboxJob.builder()
            .kind(kind)
            .status(JobStatus.PENDING)
            .createdAt(clock.instant())
            .payload(payloadJson)
            .build();
        return jobRepository.save(job).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MailboxJob> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional
    public Optional<MailboxJob> claimNext(JobKind kind) {
        return jobRepository.lockOldestPending(kind.name())
            .map(job -> take(job, JobStatus.RUNNING));
    }

    @Override
    @Transactional
    public Optional<MailboxJob> claimNextApproved(JobKind kind) {
        return jobRepository.lockOldestApproved(kind.name())
            .map(job -> take(job, JobStatus.EXECUTING));
    }

    private MailboxJob take(MailboxJob job, JobStatus next) {
        Instant now = clock.instant();
        job.setStatus(next);
        job.setStartedAt(now);
        job.setHeartbeatAt(now);
        log.debug("Claimed job {} ({}) -> {}", job.getId(), job.getKind(), next);
        return jobRepository.save(job);
    }

    @Override
    @Transactional
    public boolean requestCancel(String jobId) {
        return jobRepository.requestCancel(jobId, JobStatus.cancellable()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isCancelRequested(String jobId) {
        return jobRepository.findCancelRequested(jobId).orElse(false);
    }

    @Override
    @Transactional
    public boolean markFinished(String jobId, JobStatus status, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        int updated = jobRepository.finish(jobId, status, error, clock.instant(), JobStatus.finishable());
        if (updated > 0) {
            return true;
        }
        JobStatus current = jobRepository.findById(jobId).map(MailboxJob::getStatus).orElse(null);
        if (current == status) {
            return true;
        }
        log.warn("Refusing to finish job {} as {} from status {}", jobId, status, current);
        return false;
    }

    @Override
    @Transactional
    public void updateProgress(String jobId, Integer processed, Integer totalEstimate) {
        Instant now = clock.instant();
        if (totalEstimate != null) {
            jobRepository.updateTotalEstimate(jobId, Math.max(0, totalEstimate), now);
        }
        if (processed != null) {
            jobRepository.updateProcessed(jobId, Math.max(0, processed), now);
        }
    }

    @Override
    @Transactional
    public boolean recordApproval(String jobId, String approvedBy, String approvalPayloadJson) {
        return jobRepository.recordApproval(jobId, approvedBy, approvalPayloadJson, clock.instant()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobApproval> getApproval(String jobId) {
        return jobRepository.findById(jobId)
            .filter(MailboxJob::hasApproval)
            .map(MailboxJob::getApproval);
    }

    @Override
    @Transactional
    public boolean markApproved(String jobId) {
        return jobRepository.transition(jobId, JobStatus.APPROVED, JobStatus.approvable()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<MailboxJob> findStaleJobs(Instant heartbeatBefore) {
        return jobRepository.findByStatusInAndHeartbeatAtBefore(JobStatus.finishable(), heartbeatBefore);
    }

    @Override
    @Transactional
    public long appendEvent(String jobId, EventLevel level, String message, Map<String, Object> data) {
        // appends for one job are serialized on its row so ids commit in id order and a tail never skips one
        jobRepository.lockById(jobId);
        JobEvent event = JobEvent.builder()
            .jobId(jobId)
            .createdAt(clock.instant())
            .level(level)
            .message(message)
            .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
            .build();
        return eventRepository.save(event).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobEvent> listEvents(String jobId, long afterId, int limit) {
        return eventRepository.findByJobIdAndIdGreaterThanOrderByIdAsc(jobId, afterId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public long insertCandidate(JobCandidate candidate) {
        if (candidate.getCreatedAt() == null) {
            candidate.setCreatedAt(clock.instant());
        }
        return candidateRepository.save(candidate).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobCandidate> listCandidates(String jobId, Double minConfidence, String category, int limit) {
        Pageable page = PageRequest.of(0, limit);
        if (minConfidence != null && category != null) {
            return candidateRepository.findByJobIdAndConfidenceGreaterThanEqualAndCategoryOrderByConfidenceDescIdAsc(
                jobId, minConfidence, category, page);
        }
        if (minConfidence != null) {
            return candidateRepository.findByJobIdAndConfidenceGreaterThanEqualOrderByConfidenceDescIdAsc(
                jobId, minConfidence, page);
        }
        if (category != null) {
            return candidateRepository.findByJobIdAndCategoryOrderByConfidenceDescIdAsc(jobId, category, page);
        }
        return candidateRepository.findByJobIdOrderByConfidenceDescIdAsc(jobId, page);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobCandidate> findCandidates(String jobId, Collection<Long> candidateIds) {
        if (candidateIds.isEmpty()) {
            return List.of();
        }
        return candidateRepository.findByJobIdAndIdInOrderByConfidenceDescIdAsc(jobId, candidateIds);
    }

    @Override
    @Transactional
    public void setCandidateDecision(long candidateId, String decision) {
        candidateRepository.updateDecision(candidateId, decision);
    }

    @Override
    @Transactional
    public int decideOthers(String jobId, Collection<Long> keepIds, String decision) {
        if (keepIds.isEmpty()) {
            return candidateRepository.decideAllUndecided(jobId, decision);
        }
        return candidateRepository.decideUndecidedExcept(jobId, keepIds, decision);
    }
}
