package mailbox.jobs.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A proposed mutation for one mailbox item, produced by a triage preview job.
 */
@Entity
@Table(name = "mailbox_job_candidates", indexes = {
    @Index(name = "idx_mailbox_job_candidates_job_id", columnList = "job_id"),
    @Index(name = "idx_mailbox_job_candidates_confidence", columnList = "job_id, confidence DESC")
})
@Getter
@Setter
@ToString(exclude = "bodyPreview")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class JobCandidate {
    public static final String DECISION_EXECUTED = "executed";
    public static final String DECISION_REJECTED = "rejected";
    public static final String DECISION_ERROR_PREFIX = "error: ";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(nullable = false)
    private String uid;

    @Column(nullable = false)
    private String folder;

    @Column(length = 512)
    private String messageId;

    @Column(length = 512)
    private String fromAddr;

    @Column(columnDefinition = "TEXT")
    private String toAddr;

    @Column(columnDefinition = "TEXT")
    private String ccAddr;

    @Column(columnDefinition = "TEXT")
    private String subject;

    private Instant date;

    @Column(columnDefinition = "TEXT")
    private String bodyPreview;

    @Column(nullable = false, length = 50)
    private String category;

    private double confidence;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> signals = new LinkedHashMap<>();

    @Convert(converter = JsonListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> proposedActions = new ArrayList<>();

    @Column(length = 512)
    private String userDecision;

    private Instant createdAt;
}
