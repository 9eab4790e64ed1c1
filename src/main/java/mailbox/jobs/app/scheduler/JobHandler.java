package mailbox.jobs.app.scheduler;

/**
 * Task body for one job kind and phase. Returning normally completes the job; throwing fails it
 * with the exception message. Cancellation is honoured by returning early.
 */
@FunctionalInterface
public interface JobHandler {
    void handle(JobContext context) throws Exception;
}
