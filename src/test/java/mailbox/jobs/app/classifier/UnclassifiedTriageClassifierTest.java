package mailbox.jobs.app.classifier;

import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.model.TriageIdentity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnclassifiedTriageClassifierTest {

    @Test
    void classify_ShouldLeaveEveryMessageUnclearAtZeroConfidence() {
        // Given
        List<MailMessage> messages = List.of(
            MailMessage.builder().uid("1").folder("INBOX").subject("Quarterly report").build(),
            MailMessage.builder().uid("2").folder("Work").subject("Lunch?").build());

        // When
        List<TriageClassification> result = new UnclassifiedTriageClassifier()
            .classify(messages, new TriageIdentity("me@example.com", "Me", List.of()));

        // Then
        assertEquals(2, result.size());
        assertEquals("1", result.get(0).getUid());
        assertEquals("Work", result.get(1).getFolder());
        assertTrue(result.stream().allMatch(c -> "unclear".equals(c.getCategory())));
        assertTrue(result.stream().allMatch(c -> c.getConfidence() == 0.0));
        assertTrue(result.stream().allMatch(c -> c.getActions().isEmpty()));
    }
}
