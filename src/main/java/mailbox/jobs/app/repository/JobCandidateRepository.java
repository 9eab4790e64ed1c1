package mailbox.jobs.app.repository;

import mailbox.jobs.app.entity.JobCandidate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface JobCandidateRepository extends JpaRepository<JobCandidate, Long> {
    List<JobCandidate> findByJobIdOrderByConfidenceDescIdAsc(String jobId, Pageable pageable);

    List<JobCandidate> findByJobIdAndConfidenceGreaterThanEqualOrderByConfidenceDescIdAsc(
        String jobId, double minConfidence, Pageable pageable);

    List<JobCandidate> findByJobIdAndCategoryOrderByConfidenceDescIdAsc(
        String jobId, String category, Pageable pageable);

    List<JobCandidate> findByJobIdAndConfidenceGreaterThanEqualAndCategoryOrderByConfidenceDescIdAsc(
        String jobId, double minConfidence, String category, Pageable pageable);

    List<JobCandidate> findByJobIdAndIdInOrderByConfidenceDescIdAsc(String jobId, Collection<Long> ids);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE JobCandidate c SET c.userDecision = :decision WHERE c.id = :id")
    int updateDecision(@Param("id") Long id, @Param("decision") String decision);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE JobCandidate c SET c.userDecision = :decision " +
        "WHERE c.jobId = :jobId AND c.userDecision IS NULL AND c.id NOT IN :keep")
    int decideUndecidedExcept(@Param("jobId") String jobId,
                              @Param("keep") Collection<Long> keep,
                              @Param("decision") String decision);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE JobCandidate c SET c.userDecision = :decision WHERE c.jobId = :jobId AND c.userDecision IS NULL")
    int decideAllUndecided(@Param("jobId") String jobId, @Param("decision") String decision);
}
