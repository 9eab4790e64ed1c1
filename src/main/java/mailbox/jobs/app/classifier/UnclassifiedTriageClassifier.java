package mailbox.jobs.app.classifier;

import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.model.TriageIdentity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Used when no AI provider is configured: every message is left for human review.
 */
public class UnclassifiedTriageClassifier implements TriageClassifier {

    @Override
    public List<TriageClassification> classify(List<MailMessage> messages, TriageIdentity identity) {
        return messages.stream()
            .map(message -> TriageClassification.builder()
                .uid(message.getUid())
                .folder(message.getFolder())
                .category(TriageCategory.UNCLEAR.getValue())
                .confidence(0.0)
                .reasoning("No classifier configured")
                .build())
            .collect(Collectors.toList());
    }
}
