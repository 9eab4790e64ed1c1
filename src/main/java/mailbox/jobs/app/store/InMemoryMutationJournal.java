package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.model.MailItemRef;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

public class InMemoryMutationJournal implements MutationJournal {
    private final Map<Long, MutationRecord> records = new LinkedHashMap<>();
    private final Clock clock;
    private long sequence;

    public InMemoryMutationJournal(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized long create(MailItemRef item, String action, Map<String, Object> params, Map<String, Object> preState) {
        long id = ++sequence;
        Instant now = clock.instant();
        records.put(id, MutationRecord.builder()
            .id(id)
            .emailUid(item.getUid())
            .emailFolder(item.getFolder())
            .action(action)
            .params(params)
            .preState(preState)
            .status(MutationStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build());
        return id;
    }

    @Override
    public synchronized void updateStatus(long mutationId, MutationStatus status, String error) {
        MutationRecord record = records.get(mutationId);
        if (record == null) {
            throw new IllegalArgumentException("Mutation not found: " + mutationId);
        }
        record.setStatus(status);
        record.setError(error);
        record.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized Optional<MutationRecord> get(long mutationId) {
        return Optional.ofNullable(records.get(mutationId)).map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized List<MutationRecord> pending(MailItemRef item) {
        return history(item).stream()
            .filter(r -> r.getStatus() == MutationStatus.PENDING)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<MutationRecord> history(MailItemRef item) {
        return records.values().stream()
            .filter(r -> r.getEmailUid().equals(item.getUid()) && r.getEmailFolder().equals(item.getFolder()))
            .map(r -> r.toBuilder().build())
            .collect(Collectors.toList());
    }
}
