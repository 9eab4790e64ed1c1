package mailbox.jobs.app.mailbox;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.MutationStatus;
import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Runs mailbox mutations through the mutation journal.
 *
 * <p>Each call captures the item's pre-state, writes a pending journal row, performs the
 * mutation and then records {@code APPLIED} or {@code FAILED}. A pending row that cannot be
 * written stops the mutation. A status update that cannot be written is logged only: the
 * outcome reported to the caller is always the mutation's own result.</p>
 *
 * <p>Successful mutations are mirrored into the local message cache on a best-effort basis.</p>
 */
@Slf4j
public class JournaledMailboxMutator {
    private final MailboxClient client;
    private final MutationJournal journal;
    private final MessageCache cache;

    public JournaledMailboxMutator(MailboxClient client, MutationJournal journal, MessageCache cache) {
        this.client = client;
        this.journal = journal;
        this.cache = cache;
    }

    public void markRead(MailItemRef item) throws IOException {
        apply(item, MailboxOperation.MARK_READ, Map.of(), () -> client.markRead(item));
        mirror(item, () -> cache.markRead(item));
    }

    public void markUnread(MailItemRef item) throws IOException {
        apply(item, MailboxOperation.MARK_UNREAD, Map.of(), () -> client.markUnread(item));
    }

    public void move(MailItemRef item, String destination) throws IOException {
        apply(item, MailboxOperation.MOVE, Map.of("destination", destination), () -> client.move(item, destination));
        mirror(item, () -> cache.remove(item));
    }

    public void addLabels(MailItemRef item, List<String> labels) throws IOException {
        apply(item, MailboxOperation.ADD_LABELS, Map.of("labels", labels), () -> client.addLabels(item, labels));
        mirror(item, () -> labels.forEach(label -> cache.addLabel(item, label)));
    }

    public void removeLabels(MailItemRef item, List<String> labels) throws IOException {
        apply(item, MailboxOperation.REMOVE_LABELS, Map.of("labels", labels), () -> client.removeLabels(item, labels));
        mirror(item, () -> labels.forEach(label -> cache.removeLabel(item, label)));
    }

    private void apply(MailItemRef item, MailboxOperation operation, Map<String, Object> params, Mutation mutation)
            throws IOException {
        Map<String, Object> preState = null;
        try {
            preState = client.fetchState(item).toSnapshot();
        } catch (MailboxConflictException e) {
            long mutationId = journal.create(item, operation.getValue(), params, null);
            recordOutcome(mutationId, MutationStatus.FAILED, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not capture pre-state of {} in {} before {}: {}",
                item.getUid(), item.getFolder(), operation.getValue(), e.getMessage());
        }

        long mutationId = journal.create(item, operation.getValue(), params, preState);
        try {
            mutation.run();
        } catch (IOException | RuntimeException e) {
            recordOutcome(mutationId, MutationStatus.FAILED, e.getMessage());
            throw e;
        }
        recordOutcome(mutationId, MutationStatus.APPLIED, null);
    }

    private void recordOutcome(long mutationId, MutationStatus status, String error) {
        try {
            journal.updateStatus(mutationId, status, error);
        } catch (RuntimeException e) {
            log.error("Could not record {} for mutation {}: {}", status, mutationId, e.getMessage(), e);
        }
    }

    private void mirror(MailItemRef item, Runnable cacheUpdate) {
        try {
            cacheUpdate.run();
        } catch (RuntimeException e) {
            log.warn("Cache update failed for {} in {}: {}", item.getUid(), item.getFolder(), e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Mutation {
        void run() throws IOException;
    }
}
