package mailbox.jobs.app.repository;

import mailbox.jobs.app.entity.JobEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobEventRepository extends JpaRepository<JobEvent, Long> {
    List<JobEvent> findByJobIdAndIdGreaterThanOrderByIdAsc(String jobId, Long afterId, Pageable pageable);
}
