package mailbox.jobs.app.repository;

import mailbox.jobs.app.entity.CachedMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CachedMessageRepository extends JpaRepository<CachedMessage, Long> {
    Optional<CachedMessage> findByUidAndFolder(String uid, String folder);

    List<CachedMessage> findByFolderAndUnreadTrueOrderByDateDescIdAsc(String folder, Pageable pageable);

    @Query(value = "SELECT * FROM cached_messages WHERE folder = :folder " +
        "ORDER BY date DESC NULLS LAST, id ASC OFFSET :offset LIMIT :limit", nativeQuery = true)
    List<CachedMessage> findPage(@Param("folder") String folder, @Param("offset") int offset, @Param("limit") int limit);

    @Query("SELECT m.uid FROM CachedMessage m WHERE m.folder = :folder")
    List<String> findUidsByFolder(@Param("folder") String folder);

    long countByFolder(String folder);

    long deleteByUidAndFolder(String uid, String folder);
}
