package mailbox.jobs.app.controller;

import mailbox.jobs.app.dto.ApprovalResponse;
import mailbox.jobs.app.dto.CandidateBuckets;
import mailbox.jobs.app.dto.JobCreatedResponse;
import mailbox.jobs.app.dto.JobSnapshot;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.payload.ApprovalPayload;
import mailbox.jobs.app.service.ApprovalService;
import mailbox.jobs.app.service.CandidateService;
import mailbox.jobs.app.service.JobEventStreamService;
import mailbox.jobs.app.service.JobService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * Producer API for mailbox jobs.
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobService jobService;
    private final CandidateService candidateService;
    private final ApprovalService approvalService;
    private final JobEventStreamService eventStreamService;

    public JobController(
            JobService jobService,
            CandidateService candidateService,
            ApprovalService approvalService,
            JobEventStreamService eventStreamService) {
        this.jobService = jobService;
        this.candidateService = candidateService;
        this.approvalService = approvalService;
        this.eventStreamService = eventStreamService;
    }

    @PostMapping("/sync")
    public JobCreatedResponse createSyncJob(@RequestBody(required = false) Map<String, Object> body) {
        return jobService.createJob(JobKind.MAILBOX_SYNC, body);
    }

    @PostMapping("/triage")
    public JobCreatedResponse createTriagePreviewJob(@RequestBody(required = false) Map<String, Object> body) {
        return jobService.createJob(JobKind.TRIAGE_PREVIEW, body);
    }

    @PostMapping("/cleanup")
    public JobCreatedResponse createCleanupJob(@RequestBody Map<String, Object> body) {
        return jobService.createJob(JobKind.BULK_CLEANUP, body);
    }

    @PostMapping("/triage-apply")
    public JobCreatedResponse createTriageApplyJob(@RequestBody Map<String, Object> body) {
        return jobService.createJob(JobKind.TRIAGE_APPLY, body);
    }

    @GetMapping("/{jobId}")
    public JobSnapshot getJob(@PathVariable String jobId) {
        return jobService.getJob(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public Map<String, Object> cancelJob(@PathVariable String jobId) {
        return Map.of("ok", jobService.cancel(jobId));
    }

    @GetMapping("/{jobId}/candidates")
    public CandidateBuckets getCandidates(
            @PathVariable String jobId,
            @RequestParam(name = "min_confidence", required = false) Double minConfidence,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Integer limit) {
        return candidateService.listCandidates(jobId, minConfidence, category, limit);
    }

    /**
     * Approves a completed triage preview. The approver is taken from {@code X-User-Id}.
     */
    @PostMapping("/{jobId}/approve")
    public ApprovalResponse approveJob(
            @PathVariable String jobId,
            @RequestBody ApprovalPayload body,
            @RequestHeader(name = "X-User-Id", required = false) String userId) {
        return approvalService.approve(jobId, body, userId);
    }

    @GetMapping(path = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(
            @PathVariable String jobId,
            @RequestParam(name = "after_id", defaultValue = "0") long afterId) {
        return eventStreamService.open(jobId, afterId);
    }
}
