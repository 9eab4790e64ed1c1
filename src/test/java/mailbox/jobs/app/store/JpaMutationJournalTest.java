package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.repository.MutationRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaMutationJournalTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private MutationRecordRepository repository;

    private JpaMutationJournal journal;

    @BeforeEach
    void setUp() {
        journal = new JpaMutationJournal(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void create_ShouldSavePendingRowWithPreState() {
        // Given
        when(repository.save(any(MutationRecord.class))).thenAnswer(invocation -> {
            MutationRecord record = invocation.getArgument(0);
            record.setId(17L);
            return record;
        });

        // When
        long id = journal.create(MailItemRef.of("5", "INBOX"), "move",
            Map.of("destination", "Archive"), Map.of("flags", "\\Seen"));

        // Then
        assertEquals(17L, id);
        ArgumentCaptor<MutationRecord> captor = ArgumentCaptor.forClass(MutationRecord.class);
        verify(repository).save(captor.capture());
        MutationRecord saved = captor.getValue();
        assertEquals(MutationStatus.PENDING, saved.getStatus());
        assertEquals("5", saved.getEmailUid());
        assertEquals("INBOX", saved.getEmailFolder());
        assertEquals("Archive", saved.getParams().get("destination"));
        assertEquals("\\Seen", saved.getPreState().get("flags"));
        assertEquals(NOW, saved.getCreatedAt());
    }

    @Test
    void updateStatus_ShouldRecordOutcomeAndError() {
        // Given
        MutationRecord record = MutationRecord.builder()
            .id(3L).emailUid("5").emailFolder("INBOX").action("move")
            .status(MutationStatus.PENDING)
            .createdAt(NOW.minusSeconds(5)).updatedAt(NOW.minusSeconds(5))
            .build();
        when(repository.findById(3L)).thenReturn(Optional.of(record));

        // When
        journal.updateStatus(3L, MutationStatus.FAILED, "Message no longer exists");

        // Then
        assertEquals(MutationStatus.FAILED, record.getStatus());
        assertEquals("Message no longer exists", record.getError());
        assertEquals(NOW, record.getUpdatedAt());
        verify(repository).save(record);
    }

    @Test
    void updateStatus_UnknownId_ShouldThrow() {
        // Given
        when(repository.findById(99L)).thenReturn(Optional.empty());

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> journal.updateStatus(99L, MutationStatus.APPLIED, null));
        verify(repository, never()).save(any());
    }
}
