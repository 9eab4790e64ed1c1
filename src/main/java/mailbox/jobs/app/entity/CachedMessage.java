package mailbox.jobs.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Local snapshot of a remote message, refreshed by sync jobs and read by triage.
 */
@Entity
@Table(name = "cached_messages",
    uniqueConstraints = @UniqueConstraint(name = "uq_cached_messages_uid_folder", columnNames = {"uid", "folder"}),
    indexes = @Index(name = "idx_cached_messages_folder_unread", columnList = "folder, unread"))
@Getter
@Setter
@ToString(exclude = "bodyText")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CachedMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

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
    private String bodyText;

    private boolean unread;

    @Convert(converter = JsonListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> labels = new ArrayList<>();

    private Instant syncedAt;
}
