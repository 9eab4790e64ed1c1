package mailbox.jobs.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * Audit row for one attempted mailbox mutation. Independent of jobs and candidates.
 */
@Entity
@Table(name = "mutation_journal", indexes = {
    @Index(name = "idx_mutation_journal_item", columnList = "email_uid, email_folder")
})
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MutationRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email_uid", nullable = false)
    private String emailUid;

    @Column(name = "email_folder", nullable = false)
    private String emailFolder;

    @Column(nullable = false)
    private String action;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> params;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MutationStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> preState;

    @Column(columnDefinition = "TEXT")
    private String error;

    private Instant createdAt;

    private Instant updatedAt;
}
