package mailbox.jobs.app.scheduler;

import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.JobStore;

import java.util.Map;

/**
 * What a handler sees of the job it runs: the claimed snapshot plus event, progress and
 * cancellation access through the store.
 */
public class JobContext {
    private final MailboxJob job;
    private final JobStore store;

    public JobContext(MailboxJob job, JobStore store) {
        this.job = job;
        this.store = store;
    }

    public MailboxJob getJob() {
        return job;
    }

    public String getJobId() {
        return job.getId();
    }

    public String getPayload() {
        return job.getPayload();
    }

    public JobStore getStore() {
        return store;
    }

    /**
     * True once a user asked for cancellation, or once the job was finished by someone else
     * (the stale job reaper). Either way the handler must stop at its next check.
     */
    public boolean isCancelRequested() {
        return store.isCancelRequested(job.getId()) || !isOwned();
    }

    /** Whether the job is still running or executing, i.e. still owned by this worker. */
    public boolean isOwned() {
        return store.getJob(job.getId())
            .map(current -> current.getStatus().isActive())
            .orElse(false);
    }

    public void event(String message) {
        store.appendEvent(job.getId(), message);
    }

    public void event(EventLevel level, String message, Map<String, Object> data) {
        store.appendEvent(job.getId(), level, message, data);
    }

    public void progress(Integer processed, Integer totalEstimate) {
        store.updateProgress(job.getId(), processed, totalEstimate);
    }
}
