package mailbox.jobs.app.handler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.classifier.TriageClassifier;
import mailbox.jobs.app.config.TriageProperties;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.model.ConfidenceBucket;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.payload.TriagePreviewPayload;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.scheduler.JobHandler;
import mailbox.jobs.app.store.MessageCache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Proposal phase of triage: classifies unread cached messages and stores one candidate each.
 * Nothing in the mailbox is touched.
 */
@Slf4j
public class TriagePreviewHandler implements JobHandler {
    static final int BODY_PREVIEW_CHARS = 300;
    static final int PROGRESS_EVERY = 50;

    private final JobPayloadCodec codec;
    private final MessageCache cache;
    private final TriageClassifier classifier;
    private final TriageProperties properties;

    public TriagePreviewHandler(JobPayloadCodec codec, MessageCache cache, TriageClassifier classifier,
                                TriageProperties properties) {
        this.codec = codec;
        this.cache = cache;
        this.classifier = classifier;
        this.properties = properties;
    }

    @Override
    public void handle(JobContext context) {
        TriagePreviewPayload payload = codec.decode(context.getPayload(), TriagePreviewPayload.class);
        String folder = payload.getFolder() != null ? payload.getFolder() : "INBOX";
        int limit = payload.getLimit() != null ? payload.getLimit() : properties.getPreviewLimit();

        List<MailMessage> messages = cache.findUnread(folder, limit);
        context.progress(0, messages.size());
        if (messages.isEmpty()) {
            context.event("No unread messages in " + folder);
            return;
        }
        if (context.isCancelRequested()) {
            context.event("Job cancelled by user before classification");
            return;
        }

        // the classify call sends no heartbeat; a lease timeout must outlast it
        List<TriageClassification> classifications = classifier.classify(messages, properties.identity());
        if (!context.isOwned()) {
            log.warn("Job {} was finished elsewhere during classification; dropping {} results",
                context.getJobId(), classifications.size());
            return;
        }
        context.progress(0, null);

        long high = classifications.stream()
            .filter(c -> ConfidenceBucket.of(c.getConfidence()) == ConfidenceBucket.HIGH)
            .count();
        Map<String, Long> byCategory = classifications.stream()
            .collect(Collectors.groupingBy(TriageClassification::getCategory, TreeMap::new, Collectors.counting()));
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("by_category", byCategory);
        summary.put("high_confidence", high);
        context.event(EventLevel.INFO, "Classified " + classifications.size() + " emails: " + high
            + " high confidence, " + (classifications.size() - high) + " needs review", summary);

        Map<String, MailMessage> byUid = messages.stream()
            .collect(Collectors.toMap(MailMessage::getUid, Function.identity(), (a, b) -> a));
        int stored = 0;
        for (TriageClassification classification : classifications) {
            MailMessage message = byUid.get(classification.getUid());
            if (message == null) {
                log.warn("Job {}: classifier returned unknown uid {}", context.getJobId(), classification.getUid());
                continue;
            }
            context.getStore().insertCandidate(toCandidate(context.getJobId(), message, classification));
            stored++;
            if (stored % PROGRESS_EVERY == 0) {
                context.progress(stored, null);
            }
        }
        context.progress(stored, null);
        context.event("Stored " + stored + " candidates for review");
    }

    private JobCandidate toCandidate(String jobId, MailMessage message, TriageClassification classification) {
        String body = message.getBodyText() == null ? "" : message.getBodyText();
        Map<String, Object> signals = new LinkedHashMap<>();
        signals.put("reasoning", classification.getReasoning());
        return JobCandidate.builder()
            .jobId(jobId)
            .uid(message.getUid())
            .folder(message.getFolder())
            .messageId(message.getMessageId())
            .fromAddr(message.getFromAddr())
            .toAddr(message.getToAddr())
            .ccAddr(message.getCcAddr())
            .subject(message.getSubject())
            .date(message.getDate())
            .bodyPreview(body.length() > BODY_PREVIEW_CHARS ? body.substring(0, BODY_PREVIEW_CHARS) : body)
            .category(classification.getCategory())
            .confidence(classification.getConfidence())
            .signals(signals)
            .proposedActions(new ArrayList<>(classification.getActions()))
            .build();
    }
}
