package mailbox.jobs.app.repository;

import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MutationRecordRepository extends JpaRepository<MutationRecord, Long> {
    List<MutationRecord> findByEmailUidAndEmailFolderOrderByCreatedAtAscIdAsc(String emailUid, String emailFolder);

    List<MutationRecord> findByEmailUidAndEmailFolderAndStatusOrderByCreatedAtAscIdAsc(
        String emailUid, String emailFolder, MutationStatus status);
}
