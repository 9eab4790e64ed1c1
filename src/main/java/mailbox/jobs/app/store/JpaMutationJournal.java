package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.repository.MutationRecordRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JpaMutationJournal implements MutationJournal {
    private final MutationRecordRepository repository;
    private final Clock clock;

    public JpaMutationJournal(MutationRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public long create(MailItemRef item, String action, Map<String, Object> params, Map<String, Object> preState) {
        Instant now = clock.instant();
        MutationRecord record = MutationRecord.builder()
            .emailUid(item.getUid())
            .emailFolder(item.getFolder())
            .action(action)
            .params(params)
            .preState(preState)
            .status(MutationStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
        return repository.save(record).getId();
    }

    @Override
    @Transactional
    public void updateStatus(long mutationId, MutationStatus status, String error) {
        MutationRecord record = repository.findById(mutationId)
            .orElseThrow(() -> new IllegalArgumentException("Mutation not found: " + mutationId));
        record.setStatus(status);
        record.setError(error);
        record.setUpdatedAt(clock.instant());
        repository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MutationRecord> get(long mutationId) {
        return repository.findById(mutationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MutationRecord> pending(MailItemRef item) {
        return repository.findByEmailUidAndEmailFolderAndStatusOrderByCreatedAtAscIdAsc(
            item.getUid(), item.getFolder(), MutationStatus.PENDING);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MutationRecord> history(MailItemRef item) {
        return repository.findByEmailUidAndEmailFolderOrderByCreatedAtAscIdAsc(item.getUid(), item.getFolder());
    }
}
