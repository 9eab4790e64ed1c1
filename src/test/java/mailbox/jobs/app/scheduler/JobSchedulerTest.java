package mailbox.jobs.app.scheduler;

import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.InMemoryJobStore;
import mailbox.jobs.app.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JobSchedulerTest {

    private InMemoryJobStore store;
    private List<String> handled;
    private List<Runnable> deferred;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(Clock.systemUTC());
        handled = new ArrayList<>();
        deferred = new ArrayList<>();
    }

    @Test
    void pollOnce_ShouldClaimInRoutePriorityOrder() {
        // Given
        store.createJob(JobKind.TRIAGE_APPLY, "{}");
        store.createJob(JobKind.BULK_CLEANUP, "{}");
        store.createJob(JobKind.TRIAGE_PREVIEW, null);
        store.createJob(JobKind.MAILBOX_SYNC, null);
        JobScheduler scheduler = new JobScheduler(store, routes(), Runnable::run, 10, Duration.ofMillis(10));

        // When
        int started = scheduler.pollOnce();

        // Then
        assertEquals(4, started);
        assertEquals(List.of("sync", "triage_preview", "bulk_cleanup", "triage_apply"), handled);
    }

    @Test
    void pollOnce_ShouldRunApprovedProposalsAfterPendingPreviews() {
        // Given
        String approved = store.createJob(JobKind.TRIAGE_PREVIEW, null);
        store.markApproved(approved);
        store.createJob(JobKind.TRIAGE_PREVIEW, null);
        store.createJob(JobKind.BULK_CLEANUP, "{}");
        JobScheduler scheduler = new JobScheduler(store, routes(), Runnable::run, 10, Duration.ofMillis(10));

        // When
        scheduler.pollOnce();

        // Then
        assertEquals(List.of("triage_preview", "triage_preview (approved)", "bulk_cleanup"), handled);
        assertEquals(JobStatus.COMPLETED, store.getJob(approved).orElseThrow().getStatus());
    }

    @Test
    void pollOnce_ShouldNotExceedConcurrencyBound() {
        // Given
        for (int i = 0; i < 5; i++) {
            store.createJob(JobKind.BULK_CLEANUP, "{}");
        }
        Executor holdingExecutor = deferred::add;
        JobScheduler scheduler = new JobScheduler(store, routes(), holdingExecutor, 3, Duration.ofMillis(10));

        // When
        int firstPass = scheduler.pollOnce();
        int secondPass = scheduler.pollOnce();

        // Then
        assertEquals(3, firstPass);
        assertEquals(0, secondPass);
        assertEquals(3, scheduler.activeJobs());

        // When the held workers finish, the remaining jobs are claimed
        deferred.forEach(Runnable::run);
        deferred.clear();
        assertEquals(0, scheduler.activeJobs());
        assertEquals(2, scheduler.pollOnce());
    }

    @Test
    void pollOnce_WhenPoolRejects_ShouldFailTheClaimedJob() {
        // Given
        String jobId = store.createJob(JobKind.MAILBOX_SYNC, null);
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        JobScheduler scheduler = new JobScheduler(store, routes(), rejecting, 3, Duration.ofMillis(10));

        // When
        scheduler.pollOnce();

        // Then
        MailboxJob job = store.getJob(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("Worker pool rejected job", job.getError());
        assertTrue(handled.isEmpty());
    }

    @Test
    void pollOnce_WhenOneQueueFailsToClaim_ShouldStillServeOthers() {
        // Given
        JobStore failingStore = mock(JobStore.class);
        when(failingStore.claimNext(JobKind.MAILBOX_SYNC)).thenThrow(new IllegalStateException("lock timeout"));
        when(failingStore.claimNext(JobKind.BULK_CLEANUP))
            .thenReturn(Optional.of(MailboxJob.builder().id("c1").kind(JobKind.BULK_CLEANUP).status(JobStatus.RUNNING).build()))
            .thenReturn(Optional.empty());
        List<JobRoute> routes = List.of(
            JobRoute.pending(JobKind.MAILBOX_SYNC, context -> handled.add("sync"), "Sync job claimed"),
            JobRoute.pending(JobKind.BULK_CLEANUP, context -> handled.add("bulk_cleanup"), "Cleanup job claimed"));
        JobScheduler scheduler = new JobScheduler(failingStore, routes, Runnable::run, 3, Duration.ofMillis(10));

        // When
        int started = scheduler.pollOnce();

        // Then
        assertEquals(1, started);
        assertEquals(List.of("bulk_cleanup"), handled);
    }

    @Test
    void constructor_WithNonPositiveConcurrency_ShouldReject() {
        assertThrows(IllegalArgumentException.class,
            () -> new JobScheduler(store, routes(), Runnable::run, 0, Duration.ofMillis(10)));
    }

    private List<JobRoute> routes() {
        return List.of(
            JobRoute.pending(JobKind.MAILBOX_SYNC, recording("sync"), "Sync job claimed"),
            JobRoute.pending(JobKind.TRIAGE_PREVIEW, recording("triage_preview"), "Triage preview job claimed"),
            JobRoute.approved(JobKind.TRIAGE_PREVIEW, recording("triage_preview (approved)"), "Triage execution claimed"),
            JobRoute.pending(JobKind.BULK_CLEANUP, recording("bulk_cleanup"), "Cleanup job claimed"),
            JobRoute.pending(JobKind.TRIAGE_APPLY, recording("triage_apply"), "Triage apply job claimed"));
    }

    private JobHandler recording(String name) {
        return context -> handled.add(name);
    }
}
