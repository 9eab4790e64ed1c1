package mailbox.jobs.app.repository;

import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MailboxJobRepository extends JpaRepository<MailboxJob, String> {

    // Row lock on the oldest pending job; rows locked by another claimer are skipped, not waited on.
    @Query(value = "SELECT * FROM mailbox_jobs WHERE status = 'PENDING' AND job_kind = :kind " +
        "ORDER BY created_at ASC LIMIT 1 FOR UPDATE SKIP LOCKED", nativeQuery = true)
    Optional<MailboxJob> lockOldestPending(@Param("kind") String kind);

    @Query(value = "SELECT * FROM mailbox_jobs WHERE status = 'APPROVED' AND job_kind = :kind " +
        "ORDER BY approved_at ASC LIMIT 1 FOR UPDATE SKIP LOCKED", nativeQuery = true)
    Optional<MailboxJob> lockOldestApproved(@Param("kind") String kind);

    @Query(value = "SELECT id FROM mailbox_jobs WHERE id = :id FOR UPDATE", nativeQuery = true)
    Optional<String> lockById(@Param("id") String id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET j.cancelRequested = true WHERE j.id = :id AND j.status IN :statuses")
    int requestCancel(@Param("id") String id, @Param("statuses") Collection<JobStatus> statuses);

    @Query("SELECT j.cancelRequested FROM MailboxJob j WHERE j.id = :id")
    Optional<Boolean> findCancelRequested(@Param("id") String id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET j.status = :status, j.finishedAt = :finishedAt, j.error = :error " +
        "WHERE j.id = :id AND j.status IN :from")
    int finish(@Param("id") String id,
               @Param("status") JobStatus status,
               @Param("error") String error,
               @Param("finishedAt") Instant finishedAt,
               @Param("from") Collection<JobStatus> from);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET j.status = :status WHERE j.id = :id AND j.status IN :from")
    int transition(@Param("id") String id,
                   @Param("status") JobStatus status,
                   @Param("from") Collection<JobStatus> from);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET j.approval.approvedAt = :approvedAt, j.approval.approvedBy = :approvedBy, " +
        "j.approval.approvalPayload = :payload WHERE j.id = :id AND j.approval.approvedAt IS NULL")
    int recordApproval(@Param("id") String id,
                       @Param("approvedBy") String approvedBy,
                       @Param("payload") String payload,
                       @Param("approvedAt") Instant approvedAt);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET j.totalEstimate = :total, " +
        "j.processed = CASE WHEN j.processed > :total THEN :total ELSE j.processed END, " +
        "j.heartbeatAt = :now WHERE j.id = :id")
    int updateTotalEstimate(@Param("id") String id, @Param("total") int total, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MailboxJob j SET " +
        "j.processed = CASE WHEN j.totalEstimate IS NOT NULL AND :processed > j.totalEstimate " +
        "THEN j.totalEstimate ELSE :processed END, " +
        "j.heartbeatAt = :now WHERE j.id = :id")
    int updateProcessed(@Param("id") String id, @Param("processed") int processed, @Param("now") Instant now);

    List<MailboxJob> findByStatusInAndHeartbeatAtBefore(Collection<JobStatus> statuses, Instant cutoff);
}
