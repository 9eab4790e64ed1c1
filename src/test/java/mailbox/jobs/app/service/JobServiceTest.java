package mailbox.jobs.app.service;

import mailbox.jobs.app.dto.JobCreatedResponse;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.exception.InvalidJobPayloadException;
import mailbox.jobs.app.exception.JobNotFoundException;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock
    private JobStore store;

    private JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService(store, new JobPayloadCodec());
    }

    @Test
    void createJob_WithCleanupPayload_ShouldQueueJobAndEmitEvent() {
        // Given
        Map<String, Object> payload = Map.of("uids", List.of(
            Map.of("uid", "1", "folder", "INBOX"),
            Map.of("uid", "2")));
        when(store.createJob(eq(JobKind.BULK_CLEANUP), anyString())).thenReturn("job-1");

        // When
        JobCreatedResponse response = jobService.createJob(JobKind.BULK_CLEANUP, payload);

        // Then
        assertEquals("job-1", response.getJobId());
        assertEquals("pending", response.getStatus());
        assertEquals(2, response.getCount());
        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(store).createJob(eq(JobKind.BULK_CLEANUP), stored.capture());
        assertTrue(stored.getValue().contains("\"uid\":\"2\""));
        verify(store).appendEvent("job-1", EventLevel.INFO, "Cleanup job queued: 2 items", Map.of("kind", "bulk_cleanup"));
    }

    @Test
    void createJob_SyncWithoutPayload_ShouldOmitCount() {
        // Given
        when(store.createJob(eq(JobKind.MAILBOX_SYNC), anyString())).thenReturn("job-2");

        // When
        JobCreatedResponse response = jobService.createJob(JobKind.MAILBOX_SYNC, null);

        // Then
        assertNull(response.getCount());
        verify(store).appendEvent("job-2", EventLevel.INFO, "Sync job queued", Map.of("kind", "sync"));
    }

    @Test
    void createJob_WithUnknownField_ShouldRejectWithoutStoring() {
        // Given
        Map<String, Object> payload = Map.of("folder", "INBOX", "bogus", true);

        // When & Then
        assertThrows(InvalidJobPayloadException.class, () -> jobService.createJob(JobKind.TRIAGE_PREVIEW, payload));
        verify(store, never()).createJob(any(), any());
    }

    @Test
    void createJob_WithUnknownAction_ShouldReject() {
        // Given
        Map<String, Object> payload = Map.of("items", List.of(Map.of("uid", "1", "actions", List.of("delete"))));

        // When & Then
        assertThrows(InvalidJobPayloadException.class, () -> jobService.createJob(JobKind.TRIAGE_APPLY, payload));
        verifyNoInteractions(store);
    }

    @Test
    void getJob_WhenUnknown_ShouldThrowNotFound() {
        // Given
        when(store.getJob("missing")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(JobNotFoundException.class, () -> jobService.getJob("missing"));
    }

    @Test
    void cancel_OnRunningJob_ShouldSetFlagAndEmitWarning() {
        // Given
        when(store.getJob("job-3")).thenReturn(Optional.of(job("job-3", JobStatus.RUNNING)));
        when(store.requestCancel("job-3")).thenReturn(true);

        // When
        boolean cancelled = jobService.cancel("job-3");

        // Then
        assertTrue(cancelled);
        verify(store).appendEvent("job-3", EventLevel.WARN, "Cancellation requested", Map.of());
    }

    @Test
    void cancel_OnFinishedJob_ShouldReturnFalseWithoutEvent() {
        // Given
        when(store.getJob("job-4")).thenReturn(Optional.of(job("job-4", JobStatus.COMPLETED)));
        when(store.requestCancel("job-4")).thenReturn(false);

        // When
        boolean cancelled = jobService.cancel("job-4");

        // Then
        assertFalse(cancelled);
        verify(store, never()).appendEvent(anyString(), any(EventLevel.class), anyString(), anyMap());
    }

    @Test
    void cancel_OnUnknownJob_ShouldThrowNotFound() {
        // Given
        when(store.getJob("missing")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(JobNotFoundException.class, () -> jobService.cancel("missing"));
        verify(store, never()).requestCancel(anyString());
    }

    private static MailboxJob job(String id, JobStatus status) {
        return MailboxJob.builder().id(id).kind(JobKind.BULK_CLEANUP).status(status).build();
    }
}
