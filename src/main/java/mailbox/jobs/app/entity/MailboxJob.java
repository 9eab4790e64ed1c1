package mailbox.jobs.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "mailbox_jobs", indexes = {
    @Index(name = "idx_mailbox_jobs_status_created_at", columnList = "status, created_at"),
    @Index(name = "idx_mailbox_jobs_status_approved_at", columnList = "status, approved_at")
})
@Getter
@Setter
@ToString(exclude = "payload")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MailboxJob {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_kind", nullable = false, length = 50)
    private JobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;

    // Refreshed on claim and on every progress update; read by the stale job reaper.
    private Instant heartbeatAt;

    private int processed;

    private Integer totalEstimate;

    private boolean cancelRequested;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Embedded
    private JobApproval approval;

    /**
     * Applies a partial progress update. Processed never exceeds the total once the total is known.
     */
    public void applyProgress(Integer newProcessed, Integer newTotalEstimate) {
        if (newTotalEstimate != null) {
            this.totalEstimate = Math.max(0, newTotalEstimate);
        }
        if (newProcessed != null) {
            this.processed = Math.max(0, newProcessed);
        }
        if (this.totalEstimate != null && this.processed > this.totalEstimate) {
            this.processed = this.totalEstimate;
        }
    }

    public boolean hasApproval() {
        return approval != null && approval.getApprovedAt() != null;
    }
}
