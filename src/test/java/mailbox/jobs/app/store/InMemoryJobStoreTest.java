package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.entity.JobEvent;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void claimNext_WithConcurrentClaimers_ShouldHandEachJobToExactlyOneWorker() throws Exception {
        // Given
        int jobCount = 50;
        for (int i = 0; i < jobCount; i++) {
            store.createJob(JobKind.BULK_CLEANUP, "{}");
        }
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        AtomicInteger claims = new AtomicInteger();

        // When
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                Optional<MailboxJob> job;
                while ((job = store.claimNext(JobKind.BULK_CLEANUP)).isPresent()) {
                    claims.incrementAndGet();
                    claimed.add(job.get().getId());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        // Then
        assertEquals(jobCount, claims.get());
        assertEquals(jobCount, claimed.size());
    }

    @Test
    void claimNext_ShouldTakeOldestPendingOfKindOnly() {
        // Given
        String first = store.createJob(JobKind.MAILBOX_SYNC, null);
        store.createJob(JobKind.TRIAGE_APPLY, "{}");
        String second = store.createJob(JobKind.MAILBOX_SYNC, null);

        // When
        MailboxJob claimed = store.claimNext(JobKind.MAILBOX_SYNC).orElseThrow();

        // Then
        assertEquals(first, claimed.getId());
        assertEquals(JobStatus.RUNNING, claimed.getStatus());
        assertNotNull(claimed.getStartedAt());
        assertEquals(JobStatus.PENDING, store.getJob(second).orElseThrow().getStatus());
    }

    @Test
    void requestCancel_OnCompletedJob_ShouldReturnFalseAndLeaveEventsAlone() {
        // Given
        String jobId = store.createJob(JobKind.MAILBOX_SYNC, null);
        store.claimNext(JobKind.MAILBOX_SYNC);
        store.markFinished(jobId, JobStatus.COMPLETED, null);
        store.appendEvent(jobId, "done");

        // When
        boolean requested = store.requestCancel(jobId);

        // Then
        assertFalse(requested);
        assertFalse(store.isCancelRequested(jobId));
        assertEquals(1, store.listEvents(jobId, 0, 100).size());
    }

    @Test
    void requestCancel_OnPendingJob_ShouldStickThroughClaim() {
        // Given
        String jobId = store.createJob(JobKind.BULK_CLEANUP, "{}");

        // When
        assertTrue(store.requestCancel(jobId));
        MailboxJob claimed = store.claimNext(JobKind.BULK_CLEANUP).orElseThrow();

        // Then
        assertTrue(claimed.isCancelRequested());
        assertTrue(store.isCancelRequested(jobId));
    }

    @Test
    void markFinished_ShouldBeIdempotentForSameStatusAndRefuseOthers() {
        // Given
        String jobId = store.createJob(JobKind.TRIAGE_APPLY, "{}");
        store.claimNext(JobKind.TRIAGE_APPLY);

        // When
        boolean first = store.markFinished(jobId, JobStatus.FAILED, "boom");
        boolean again = store.markFinished(jobId, JobStatus.FAILED, "boom");
        boolean flip = store.markFinished(jobId, JobStatus.COMPLETED, null);

        // Then
        assertTrue(first);
        assertTrue(again);
        assertFalse(flip);
        MailboxJob job = store.getJob(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("boom", job.getError());
        assertNotNull(job.getFinishedAt());
    }

    @Test
    void markFinished_OnPendingJob_ShouldBeRefused() {
        String jobId = store.createJob(JobKind.TRIAGE_APPLY, "{}");

        assertFalse(store.markFinished(jobId, JobStatus.COMPLETED, null));
        assertEquals(JobStatus.PENDING, store.getJob(jobId).orElseThrow().getStatus());
    }

    @Test
    void updateProgress_ShouldClampProcessedToTotal() {
        // Given
        String jobId = store.createJob(JobKind.BULK_CLEANUP, "{}");
        store.claimNext(JobKind.BULK_CLEANUP);

        // When
        store.updateProgress(jobId, null, 10);
        store.updateProgress(jobId, 15, null);

        // Then
        MailboxJob job = store.getJob(jobId).orElseThrow();
        assertEquals(10, job.getTotalEstimate());
        assertEquals(10, job.getProcessed());
    }

    @Test
    void recordApproval_Twice_ShouldOnlyStoreFirst() {
        // Given
        String jobId = store.createJob(JobKind.TRIAGE_PREVIEW, null);

        // When
        boolean first = store.recordApproval(jobId, "alice", "{\"candidate_ids\":[1],\"actions\":[]}");
        boolean second = store.recordApproval(jobId, "bob", "{\"candidate_ids\":[2],\"actions\":[]}");

        // Then
        assertTrue(first);
        assertFalse(second);
        assertEquals("alice", store.getApproval(jobId).orElseThrow().getApprovedBy());
    }

    @Test
    void claimNextApproved_ShouldMoveApprovedJobToExecuting() {
        // Given
        String jobId = store.createJob(JobKind.TRIAGE_PREVIEW, null);
        store.claimNext(JobKind.TRIAGE_PREVIEW);
        store.markFinished(jobId, JobStatus.COMPLETED, null);
        store.recordApproval(jobId, "alice", "{}");
        assertTrue(store.markApproved(jobId));

        // When
        Optional<MailboxJob> pendingClaim = store.claimNext(JobKind.TRIAGE_PREVIEW);
        MailboxJob executing = store.claimNextApproved(JobKind.TRIAGE_PREVIEW).orElseThrow();

        // Then
        assertTrue(pendingClaim.isEmpty());
        assertEquals(jobId, executing.getId());
        assertEquals(JobStatus.EXECUTING, executing.getStatus());
        assertFalse(store.markApproved(jobId));
    }

    @Test
    void listEvents_ShouldReturnOnlyEventsAfterCursorInOrder() {
        // Given
        String jobId = store.createJob(JobKind.MAILBOX_SYNC, null);
        String otherJob = store.createJob(JobKind.MAILBOX_SYNC, null);
        long first = store.appendEvent(jobId, "one");
        store.appendEvent(otherJob, "elsewhere");
        store.appendEvent(jobId, EventLevel.WARN, "two", Map.of("n", 2));
        store.appendEvent(jobId, "three");

        // When
        List<JobEvent> events = store.listEvents(jobId, first, 100);

        // Then
        assertEquals(List.of("two", "three"), events.stream().map(JobEvent::getMessage).collect(Collectors.toList()));
        assertEquals(EventLevel.WARN, events.get(0).getLevel());
        assertTrue(events.get(0).getId() < events.get(1).getId());
    }

    @Test
    void listCandidates_ShouldFilterAndOrderByConfidenceDescending() {
        // Given
        String jobId = store.createJob(JobKind.TRIAGE_PREVIEW, null);
        store.insertCandidate(candidate(jobId, "1", "fyi", 0.55));
        store.insertCandidate(candidate(jobId, "2", "newsletter", 0.97));
        store.insertCandidate(candidate(jobId, "3", "newsletter", 0.40));
        store.insertCandidate(candidate("other-job", "4", "newsletter", 0.99));

        // When
        List<JobCandidate> all = store.listCandidates(jobId, null, null, 10);
        List<JobCandidate> confident = store.listCandidates(jobId, 0.5, null, 10);
        List<JobCandidate> newsletters = store.listCandidates(jobId, null, "newsletter", 1);

        // Then
        assertEquals(List.of("2", "1", "3"), all.stream().map(JobCandidate::getUid).collect(Collectors.toList()));
        assertEquals(List.of("2", "1"), confident.stream().map(JobCandidate::getUid).collect(Collectors.toList()));
        assertEquals(List.of("2"), newsletters.stream().map(JobCandidate::getUid).collect(Collectors.toList()));
    }

    @Test
    void decideOthers_ShouldLeaveKeptAndDecidedCandidatesUntouched() {
        // Given
        String jobId = store.createJob(JobKind.TRIAGE_PREVIEW, null);
        long keep = store.insertCandidate(candidate(jobId, "1", "fyi", 0.9));
        long decided = store.insertCandidate(candidate(jobId, "2", "fyi", 0.8));
        long other = store.insertCandidate(candidate(jobId, "3", "fyi", 0.7));
        store.setCandidateDecision(decided, JobCandidate.DECISION_EXECUTED);

        // When
        int updated = store.decideOthers(jobId, List.of(keep), JobCandidate.DECISION_REJECTED);

        // Then
        assertEquals(1, updated);
        Map<Long, String> decisions = store.listCandidates(jobId, null, null, 10).stream()
            .collect(Collectors.toMap(JobCandidate::getId, c -> String.valueOf(c.getUserDecision())));
        assertEquals("null", decisions.get(keep));
        assertEquals(JobCandidate.DECISION_EXECUTED, decisions.get(decided));
        assertEquals(JobCandidate.DECISION_REJECTED, decisions.get(other));
    }

    @Test
    void findStaleJobs_ShouldOnlyReturnActiveJobsWithOldHeartbeat() {
        // Given
        String running = store.createJob(JobKind.BULK_CLEANUP, "{}");
        store.createJob(JobKind.BULK_CLEANUP, "{}");
        store.claimNext(JobKind.BULK_CLEANUP);

        // When
        List<MailboxJob> stale = store.findStaleJobs(Instant.parse("2024-03-01T10:05:00Z"));
        List<MailboxJob> fresh = store.findStaleJobs(Instant.parse("2024-03-01T09:55:00Z"));

        // Then
        assertEquals(List.of(running), stale.stream().map(MailboxJob::getId).collect(Collectors.toList()));
        assertTrue(fresh.isEmpty());
    }

    private static JobCandidate candidate(String jobId, String uid, String category, double confidence) {
        return JobCandidate.builder()
            .jobId(jobId)
            .uid(uid)
            .folder("INBOX")
            .category(category)
            .confidence(confidence)
            .build();
    }
}
