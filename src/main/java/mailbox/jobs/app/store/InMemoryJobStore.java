package mailbox.jobs.app.store;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.*;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local store with the same contracts as {@link JpaJobStore}.
 * Claims are serialised on the job table monitor, so each job is handed out once.
 * Callers always receive copies; mutating them does not change the stored rows.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {
    private final Map<String, MailboxJob> jobs = new LinkedHashMap<>();
    private final List<JobEvent> events = new ArrayList<>();
    private final Map<Long, JobCandidate> candidates = new LinkedHashMap<>();
    private final AtomicLong eventSequence = new AtomicLong();
    private final AtomicLong candidateSequence = new AtomicLong();
    private final AtomicLong creationSequence = new AtomicLong();
    private final Map<String, Long> creationOrder = new HashMap<>();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String createJob(JobKind kind, String payloadJson) {
        String id = UUID.randomUUID().toString();
        MailboxJob job = MailboxJob.builder()
            .id(id)
            .kind(kind)
            .status(JobStatus.PENDING)
            .createdAt(clock.instant())
            .payload(payloadJson)
            .build();
        jobs.put(id, job);
        creationOrder.put(id, creationSequence.incrementAndGet());
        return id;
    }

    @Override
    public synchronized Optional<MailboxJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(InMemoryJobStore::copy);
    }

    @Override
    public synchronized Optional<MailboxJob> claimNext(JobKind kind) {
        return jobs.values().stream()
            .filter(job -> job.getKind() == kind && job.getStatus() == JobStatus.PENDING)
            .min(Comparator.comparing(MailboxJob::getCreatedAt)
                .thenComparing(job -> creationOrder.get(job.getId())))
            .map(job -> take(job, JobStatus.RUNNING));
    }

    @Override
    public synchronized Optional<MailboxJob> claimNextApproved(JobKind kind) {
        return jobs.values().stream()
            .filter(job -> job.getKind() == kind && job.getStatus() == JobStatus.APPROVED)
            .min(Comparator.comparing((MailboxJob job) -> job.hasApproval() ? job.getApproval().getApprovedAt() : job.getCreatedAt())
                .thenComparing(job -> creationOrder.get(job.getId())))
            .map(job -> take(job, JobStatus.EXECUTING));
    }

    private MailboxJob take(MailboxJob job, JobStatus next) {
        Instant now = clock.instant();
        job.setStatus(next);
        job.setStartedAt(now);
        job.setHeartbeatAt(now);
        return copy(job);
    }

    @Override
    public synchronized boolean requestCancel(String jobId) {
        MailboxJob job = jobs.get(jobId);
        if (job == null || !JobStatus.cancellable().contains(job.getStatus())) {
            return false;
        }
        job.setCancelRequested(true);
        return true;
    }

    @Override
    public synchronized boolean isCancelRequested(String jobId) {
        MailboxJob job = jobs.get(jobId);
        return job != null && job.isCancelRequested();
    }

    @Override
    public synchronized boolean markFinished(String jobId, JobStatus status, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        MailboxJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        if (JobStatus.finishable().contains(job.getStatus())) {
            job.setStatus(status);
            job.setFinishedAt(clock.instant());
            job.setError(error);
            return true;
        }
        if (job.getStatus() == status) {
            return true;
        }
        log.warn("Refusing to finish job {} as {} from status {}", jobId, status, job.getStatus());
        return false;
    }

    @Override
    public synchronized void updateProgress(String jobId, Integer processed, Integer totalEstimate) {
        MailboxJob job = jobs.get(jobId);
        if (job == null) {
            return;
        }
        job.applyProgress(processed, totalEstimate);
        job.setHeartbeatAt(clock.instant());
    }

    @Override
    public synchronized boolean recordApproval(String jobId, String approvedBy, String approvalPayloadJson) {
        MailboxJob job = jobs.get(jobId);
        if (job == null || job.hasApproval()) {
            return false;
        }
        job.setApproval(new JobApproval(clock.instant(), approvedBy, approvalPayloadJson));
        return true;
    }

    @Override
    public synchronized Optional<JobApproval> getApproval(String jobId) {
        return Optional.ofNullable(jobs.get(jobId))
            .filter(MailboxJob::hasApproval)
            .map(MailboxJob::getApproval);
    }

    @Override
    public synchronized boolean markApproved(String jobId) {
        MailboxJob job = jobs.get(jobId);
        if (job == null || !JobStatus.approvable().contains(job.getStatus())) {
            return false;
        }
        job.setStatus(JobStatus.APPROVED);
        return true;
    }

    @Override
    public synchronized List<MailboxJob> findStaleJobs(Instant heartbeatBefore) {
        return jobs.values().stream()
            .filter(job -> job.getStatus().isActive())
            .filter(job -> job.getHeartbeatAt() != null && job.getHeartbeatAt().isBefore(heartbeatBefore))
            .map(InMemoryJobStore::copy)
            .collect(Collectors.toList());
    }

    @Override
    public long appendEvent(String jobId, EventLevel level, String message, Map<String, Object> data) {
        synchronized (events) {
            long id = eventSequence.incrementAndGet();
            events.add(JobEvent.builder()
                .id(id)
                .jobId(jobId)
                .createdAt(clock.instant())
                .level(level)
                .message(message)
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .build());
            return id;
        }
    }

    @Override
    public List<JobEvent> listEvents(String jobId, long afterId, int limit) {
        synchronized (events) {
            return events.stream()
                .filter(event -> event.getJobId().equals(jobId) && event.getId() > afterId)
                .limit(limit)
                .map(event -> event.toBuilder().data(new LinkedHashMap<>(event.getData())).build())
                .collect(Collectors.toList());
        }
    }

    @Override
    public long insertCandidate(JobCandidate candidate) {
        synchronized (candidates) {
            long id = candidateSequence.incrementAndGet();
            JobCandidate stored = candidate.toBuilder()
                .id(id)
                .createdAt(candidate.getCreatedAt() == null ? clock.instant() : candidate.getCreatedAt())
                .build();
            candidates.put(id, stored);
            return id;
        }
    }

    @Override
    public List<JobCandidate> listCandidates(String jobId, Double minConfidence, String category, int limit) {
        synchronized (candidates) {
            return candidates.values().stream()
                .filter(c -> c.getJobId().equals(jobId))
                .filter(c -> minConfidence == null || c.getConfidence() >= minConfidence)
                .filter(c -> category == null || category.equals(c.getCategory()))
                .sorted(byConfidence())
                .limit(limit)
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
        }
    }

    @Override
    public List<JobCandidate> findCandidates(String jobId, Collection<Long> candidateIds) {
        Set<Long> wanted = new HashSet<>(candidateIds);
        synchronized (candidates) {
            return candidates.values().stream()
                .filter(c -> c.getJobId().equals(jobId) && wanted.contains(c.getId()))
                .sorted(byConfidence())
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
        }
    }

    @Override
    public void setCandidateDecision(long candidateId, String decision) {
        synchronized (candidates) {
            JobCandidate candidate = candidates.get(candidateId);
            if (candidate != null) {
                candidate.setUserDecision(decision);
            }
        }
    }

    @Override
    public int decideOthers(String jobId, Collection<Long> keepIds, String decision) {
        Set<Long> keep = new HashSet<>(keepIds);
        int updated = 0;
        synchronized (candidates) {
            for (JobCandidate candidate : candidates.values()) {
                if (candidate.getJobId().equals(jobId) && candidate.getUserDecision() == null
                        && !keep.contains(candidate.getId())) {
                    candidate.setUserDecision(decision);
                    updated++;
                }
            }
        }
        return updated;
    }

    private static Comparator<JobCandidate> byConfidence() {
        return Comparator.comparingDouble(JobCandidate::getConfidence).reversed()
            .thenComparing(JobCandidate::getId);
    }

    private static MailboxJob copy(MailboxJob job) {
        return job.toBuilder().build();
    }
}
