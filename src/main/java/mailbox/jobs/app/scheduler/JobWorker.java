package mailbox.jobs.app.scheduler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.JobStore;

import java.util.Map;

/**
 * Runs one claimed job to a terminal status. The job is finished exactly once, whatever the
 * handler does.
 */
@Slf4j
public class JobWorker implements Runnable {
    static final String CANCELLED_BEFORE_START = "Job cancelled by user";

    private final JobStore store;
    private final JobRoute route;
    private final MailboxJob job;

    public JobWorker(JobStore store, JobRoute route, MailboxJob job) {
        this.store = store;
        this.route = route;
        this.job = job;
    }

    @Override
    public void run() {
        String jobId = job.getId();
        JobStatus outcome = JobStatus.FAILED;
        String error = null;
        try {
            log.info("Starting job {} ({})", jobId, route.describe());
            store.appendEvent(jobId, route.getClaimedMessage());

            if (store.isCancelRequested(jobId)) {
                store.appendEvent(jobId, CANCELLED_BEFORE_START);
                outcome = JobStatus.COMPLETED;
                return;
            }

            route.getHandler().handle(new JobContext(job, store));
            outcome = JobStatus.COMPLETED;
        } catch (Exception e) {
            error = recordFailure(jobId, e);
        } catch (Error e) {
            // the job is still failed with the error text before the Error reaches the pool
            error = recordFailure(jobId, e);
            throw e;
        } finally {
            finish(jobId, outcome, error);
        }
    }

    private String recordFailure(String jobId, Throwable failure) {
        String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        log.error("Job {} ({}) failed: {}", jobId, route.describe(), error, failure);
        try {
            store.appendEvent(jobId, EventLevel.ERROR, "Job failed: " + error, Map.of());
        } catch (RuntimeException eventError) {
            log.error("Could not record failure event for job {}: {}", jobId, eventError.getMessage());
        }
        return error;
    }

    private void finish(String jobId, JobStatus outcome, String error) {
        try {
            if (store.markFinished(jobId, outcome, error)) {
                log.info("Job {} finished with status {}", jobId, outcome.getValue());
            } else {
                log.warn("Job {} could not be moved to {}; it was finished elsewhere", jobId, outcome.getValue());
            }
        } catch (RuntimeException e) {
            log.error("Error finishing job {}: {}", jobId, e.getMessage(), e);
        }
    }
}
