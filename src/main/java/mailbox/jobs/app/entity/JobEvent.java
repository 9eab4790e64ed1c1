package mailbox.jobs.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only progress entry of a job. The id is the ordering key consumers resume from.
 */
@Entity
@Table(name = "mailbox_job_events", indexes = {
    @Index(name = "idx_mailbox_job_events_job_id_id", columnList = "job_id, id")
})
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class JobEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private EventLevel level;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String message;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
}
