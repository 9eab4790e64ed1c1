package mailbox.jobs.app.classifier;

import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.model.TriageIdentity;

import java.util.List;

/**
 * Assigns a triage category and a confidence to mailbox messages.
 */
public interface TriageClassifier {
    /**
     * Classifier quota or rate limit exceeded.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Classify a batch of messages.
     * @param messages messages to classify
     * @param identity mailbox owner, used to recognise direct mail and VIP senders
     * @return one classification per message, in input order
     * @throws QuotaException if the classifier quota is exceeded
     */
    List<TriageClassification> classify(List<MailMessage> messages, TriageIdentity identity);
}
