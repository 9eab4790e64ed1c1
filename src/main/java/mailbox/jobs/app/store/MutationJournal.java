package mailbox.jobs.app.store;

import mailbox.jobs.app.entity.MutationRecord;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.model.MailItemRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Audit trail of mailbox mutation attempts, keyed by the item they targeted.
 */
public interface MutationJournal {

    /**
     * Creates a pending journal row before the mutation is attempted.
     * @return the journal row id
     */
    long create(MailItemRef item, String action, Map<String, Object> params, Map<String, Object> preState);

    void updateStatus(long mutationId, MutationStatus status, String error);

    Optional<MutationRecord> get(long mutationId);

    /** Rows still pending for the item, oldest first. */
    List<MutationRecord> pending(MailItemRef item);

    /** Every row for the item, oldest first. */
    List<MutationRecord> history(MailItemRef item);
}
