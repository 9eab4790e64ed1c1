package mailbox.jobs.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import mailbox.jobs.app.entity.MailboxJob;

import java.time.Instant;

/**
 * Read-only view of a job as returned to producers.
 */
@Value
@Builder
public class JobSnapshot {
    String id;
    String kind;
    String status;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("started_at")
    Instant startedAt;
    @JsonProperty("finished_at")
    Instant finishedAt;
    int processed;
    @JsonProperty("total_estimate")
    Integer totalEstimate;
    @JsonProperty("cancel_requested")
    boolean cancelRequested;
    String error;
    @JsonProperty("approved_at")
    Instant approvedAt;
    @JsonProperty("approved_by")
    String approvedBy;

    public static JobSnapshot of(MailboxJob job) {
        return JobSnapshot.builder()
            .id(job.getId())
            .kind(job.getKind().getValue())
            .status(job.getStatus().getValue())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .finishedAt(job.getFinishedAt())
            .processed(job.getProcessed())
            .totalEstimate(job.getTotalEstimate())
            .cancelRequested(job.isCancelRequested())
            .error(job.getError())
            .approvedAt(job.hasApproval() ? job.getApproval().getApprovedAt() : null)
            .approvedBy(job.hasApproval() ? job.getApproval().getApprovedBy() : null)
            .build();
    }
}
