package mailbox.jobs.app.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.classifier.TriageCategory;
import mailbox.jobs.app.classifier.TriageClassifier;
import mailbox.jobs.app.config.TriageProperties;
import mailbox.jobs.app.dto.JobCreatedResponse;
import mailbox.jobs.app.dto.ScanRequest;
import mailbox.jobs.app.dto.ScanResult;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.model.ConfidenceBucket;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.payload.TriageApplyPayload;
import mailbox.jobs.app.store.MessageCache;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stateless, resumable prioritisation of a cached folder. Each call classifies one page and
 * queues a triage-apply job for it; the returned token resumes at the next page.
 */
@Slf4j
@Service
public class TriageScanService {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final MessageCache cache;
    private final TriageClassifier classifier;
    private final JobService jobService;
    private final TriageProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TriageScanService(MessageCache cache, TriageClassifier classifier, JobService jobService,
                             TriageProperties properties) {
        this.cache = cache;
        this.classifier = classifier;
        this.jobService = jobService;
        this.properties = properties;
    }

    public ScanResult prioritize(ScanRequest request) {
        String folder = request.getFolder() != null && !request.getFolder().isBlank() ? request.getFolder() : "INBOX";
        int limit = request.getLimit() != null && request.getLimit() > 0 ? request.getLimit() : properties.getScanLimit();
        int offset = decodeToken(request.getContinuationToken());

        List<MailMessage> page = cache.page(folder, offset, limit);
        if (page.isEmpty()) {
            return ScanResult.builder()
                .status("complete")
                .hasMore(false)
                .summary(Map.of())
                .build();
        }

        List<TriageClassification> classifications = classifier.classify(page, properties.identity());
        List<TriageApplyPayload.Item> items = new ArrayList<>();
        Map<String, Integer> summary = new TreeMap<>();
        int high = 0;
        for (TriageClassification classification : classifications) {
            items.add(TriageApplyPayload.Item.builder()
                .uid(classification.getUid())
                .folder(classification.getFolder())
                .label(TriageCategory.labelFor(properties.getLabelPrefix(), classification.getCategory()))
                .actions(new ArrayList<>(classification.getActions()))
                .confidence(classification.getConfidence())
                .build());
            summary.merge(classification.getCategory(), 1, Integer::sum);
            if (ConfidenceBucket.of(classification.getConfidence()) == ConfidenceBucket.HIGH) {
                high++;
            }
        }

        String jobId = null;
        if (!items.isEmpty()) {
            Map<String, Object> payload = objectMapper.convertValue(new TriageApplyPayload(items, true), MAP_TYPE);
            JobCreatedResponse created = jobService.createJob(JobKind.TRIAGE_APPLY, payload);
            jobId = created.getJobId();
        }

        long total = cache.count(folder);
        int nextOffset = offset + page.size();
        boolean hasMore = nextOffset < total;
        log.info("Prioritized {} messages of {} at offset {} ({} high confidence), job {}",
            page.size(), folder, offset, high, jobId);

        return ScanResult.builder()
            .status(hasMore ? "partial" : "complete")
            .hasMore(hasMore)
            .continuationToken(hasMore ? encodeToken(nextOffset) : null)
            .jobId(jobId)
            .totalProcessed(classifications.size())
            .highConfidenceCount(high)
            .needsReviewCount(classifications.size() - high)
            .summary(summary)
            .build();
    }

    public static String encodeToken(int offset) {
        String json = "{\"offset\":" + offset + "}";
        return Base64.getUrlEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Undecodable or missing tokens restart the scan at offset 0.
     */
    int decodeToken(String token) {
        if (token == null || token.isBlank()) {
            return 0;
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.trim());
            JsonNode state = objectMapper.readTree(json);
            int offset = state.path("offset").asInt(0);
            return Math.max(0, offset);
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Ignoring undecodable continuation token: {}", e.getMessage());
            return 0;
        }
    }
}
