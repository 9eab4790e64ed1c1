package mailbox.jobs.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Approval fields collocated on the job row. Written once.
 */
@Embeddable
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class JobApproval {
    private Instant approvedAt;

    private String approvedBy;

    @Column(columnDefinition = "TEXT")
    private String approvalPayload;
}
