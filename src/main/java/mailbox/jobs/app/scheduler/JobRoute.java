package mailbox.jobs.app.scheduler;

import lombok.Value;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.JobStore;

import java.util.Optional;

/**
 * One row of the scheduler's dispatch table: which queue to claim from and which handler runs it.
 */
@Value
public class JobRoute {
    JobKind kind;
    // true for the second phase of a proposal kind (approved -> executing)
    boolean approvedPhase;
    JobHandler handler;
    String claimedMessage;

    public static JobRoute pending(JobKind kind, JobHandler handler, String claimedMessage) {
        return new JobRoute(kind, false, handler, claimedMessage);
    }

    public static JobRoute approved(JobKind kind, JobHandler handler, String claimedMessage) {
        return new JobRoute(kind, true, handler, claimedMessage);
    }

    public Optional<MailboxJob> claim(JobStore store) {
        return approvedPhase ? store.claimNextApproved(kind) : store.claimNext(kind);
    }

    public String describe() {
        return kind.getValue() + (approvedPhase ? " (approved)" : "");
    }
}
