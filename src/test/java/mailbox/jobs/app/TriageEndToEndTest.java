package mailbox.jobs.app;

import mailbox.jobs.app.classifier.TriageCategory;
import mailbox.jobs.app.classifier.TriageClassifier;
import mailbox.jobs.app.config.JobEngineProperties;
import mailbox.jobs.app.config.MailboxProperties;
import mailbox.jobs.app.config.SchedulerConfig;
import mailbox.jobs.app.config.TriageProperties;
import mailbox.jobs.app.dto.CandidateBuckets;
import mailbox.jobs.app.dto.CandidateView;
import mailbox.jobs.app.dto.JobEventView;
import mailbox.jobs.app.entity.JobCandidate;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.exception.IllegalJobStateException;
import mailbox.jobs.app.mailbox.FakeMailboxClient;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailMessage;
import mailbox.jobs.app.model.TriageClassification;
import mailbox.jobs.app.payload.ApprovalPayload;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.scheduler.JobScheduler;
import mailbox.jobs.app.service.ApprovalService;
import mailbox.jobs.app.service.CandidateService;
import mailbox.jobs.app.service.JobEventStreamService;
import mailbox.jobs.app.service.JobService;
import mailbox.jobs.app.store.InMemoryJobStore;
import mailbox.jobs.app.store.InMemoryMessageCache;
import mailbox.jobs.app.store.InMemoryMutationJournal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Sync, preview, review, approve and execute against the in-memory backend.
 */
@ExtendWith(MockitoExtension.class)
class TriageEndToEndTest {
    private static final Map<String, Object[]> VERDICTS = Map.of(
        "u1", new Object[]{"newsletter", 0.95},
        "u2", new Object[]{"action-required", 0.6},
        "u3", new Object[]{"unclear", 0.3});

    @Mock
    private TriageClassifier classifier;

    private final JobPayloadCodec codec = new JobPayloadCodec();
    private final MailboxProperties mailboxProperties = new MailboxProperties();
    private InMemoryJobStore store;
    private InMemoryMutationJournal journal;
    private InMemoryMessageCache cache;
    private FakeMailboxClient mailbox;
    private JobScheduler scheduler;
    private JobService jobService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        store = new InMemoryJobStore(clock);
        journal = new InMemoryMutationJournal(clock);
        cache = new InMemoryMessageCache();
        mailbox = new FakeMailboxClient()
            .add("u1", "INBOX", true)
            .add("u2", "INBOX", true)
            .add("u3", "INBOX", true);
        MailboxConnectionPool pool = new MailboxConnectionPool(List.of(mailbox), Duration.ofSeconds(1));

        scheduler = new SchedulerConfig().jobScheduler(store, codec, pool, journal, cache, classifier,
            new JobEngineProperties(), mailboxProperties, new TriageProperties(), Runnable::run);
        jobService = new JobService(store, codec);

        lenient().when(classifier.classify(anyList(), any())).thenAnswer(invocation -> {
            List<MailMessage> messages = invocation.getArgument(0);
            return messages.stream().map(message -> {
                Object[] verdict = VERDICTS.get(message.getUid());
                TriageCategory category = TriageCategory.fromValue((String) verdict[0]);
                TriageClassification.TriageClassificationBuilder builder = TriageClassification.builder()
                    .uid(message.getUid())
                    .folder(message.getFolder())
                    .category(category.getValue())
                    .confidence((Double) verdict[1])
                    .reasoning("test verdict");
                category.getDefaultActions().forEach(action -> builder.action(action.getValue()));
                return builder.build();
            }).collect(Collectors.toList());
        });
    }

    @Test
    void approvedTriage_ShouldOnlyTouchApprovedCandidates() throws Exception {
        // Given a synced inbox and a finished preview
        jobService.createJob(JobKind.MAILBOX_SYNC, null);
        scheduler.pollOnce();
        assertEquals(3, cache.count("INBOX"));

        String jobId = jobService.createJob(JobKind.TRIAGE_PREVIEW, null).getJobId();
        scheduler.pollOnce();
        assertEquals(JobStatus.COMPLETED, store.getJob(jobId).orElseThrow().getStatus());
        assertTrue(journal.history(MailItemRef.of("u1", "INBOX")).isEmpty());

        CandidateService candidateService = new CandidateService(store);
        CandidateBuckets all = candidateService.listCandidates(jobId, null, null, null);
        assertEquals(3, all.getTotal());
        assertEquals(1, all.getMediumConfidence().size());
        assertEquals(1, all.getLowConfidence().size());

        CandidateBuckets confident = candidateService.listCandidates(jobId, 0.9, null, null);
        assertEquals(1, confident.getTotal());
        CandidateView newsletter = confident.getHighConfidence().get(0);
        assertEquals("u1", newsletter.getUid());
        assertEquals("newsletter", newsletter.getCategory());

        // When the reviewer approves only the newsletter
        new ApprovalService(store, codec, TransactionOperations.withoutTransaction())
            .approve(jobId, new ApprovalPayload(List.of(newsletter.getId()), List.of("mark_read", "archive")), "alice");
        assertEquals(JobStatus.APPROVED, store.getJob(jobId).orElseThrow().getStatus());
        scheduler.pollOnce();

        // Then
        assertEquals(JobStatus.COMPLETED, store.getJob(jobId).orElseThrow().getStatus());

        List<MutationRecord> mutations = journal.history(MailItemRef.of("u1", "INBOX"));
        assertEquals(List.of("mark_read", "move"),
            mutations.stream().map(MutationRecord::getAction).collect(Collectors.toList()));
        assertTrue(mutations.stream().allMatch(m -> m.getStatus() == MutationStatus.APPLIED));
        assertTrue(journal.history(MailItemRef.of("u2", "INBOX")).isEmpty());
        assertTrue(journal.history(MailItemRef.of("u3", "INBOX")).isEmpty());

        String archive = mailboxProperties.getArchiveFolder();
        assertTrue(mailbox.contains("u1", archive));
        assertFalse(mailbox.get("u1", archive).isUnread());
        assertTrue(mailbox.get("u2", "INBOX").isUnread());
        assertEquals(2, cache.count("INBOX"));

        Map<String, String> decisions = store.listCandidates(jobId, null, null, 10).stream()
            .collect(Collectors.toMap(JobCandidate::getUid, c -> String.valueOf(c.getUserDecision())));
        assertEquals(JobCandidate.DECISION_EXECUTED, decisions.get("u1"));
        assertEquals(JobCandidate.DECISION_REJECTED, decisions.get("u2"));
        assertEquals(JobCandidate.DECISION_REJECTED, decisions.get("u3"));

        List<String> streamed = new ArrayList<>();
        JobEngineProperties streamProperties = new JobEngineProperties();
        new JobEventStreamService(store, streamProperties, Runnable::run).stream(jobId, 0, new AtomicBoolean(true),
            (name, frame) -> {
                if (frame instanceof JobEventView) {
                    streamed.add(((JobEventView) frame).getMessage());
                }
            });
        assertEquals("Triage preview job queued", streamed.get(0));
        assertTrue(streamed.contains("Approved by alice: 1 candidates"));
        assertTrue(streamed.contains("Triage execution claimed"));
        assertEquals("Triage execution complete: 1 executed, 0 failed", streamed.get(streamed.size() - 1));
    }

    @Test
    void approvingRunningPreview_ShouldBeRefused() {
        // Given
        String jobId = jobService.createJob(JobKind.TRIAGE_PREVIEW, null).getJobId();
        store.claimNext(JobKind.TRIAGE_PREVIEW);
        ApprovalService approvalService = new ApprovalService(store, codec, TransactionOperations.withoutTransaction());

        // When & Then
        assertThrows(IllegalJobStateException.class, () ->
            approvalService.approve(jobId, new ApprovalPayload(List.of(), List.of("archive")), "alice"));
        verifyNoInteractions(classifier);
    }
}
