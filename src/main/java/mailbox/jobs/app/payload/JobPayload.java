package mailbox.jobs.app.payload;

import mailbox.jobs.app.exception.InvalidJobPayloadException;

/**
 * Kind-specific job input. Validated when a producer creates the job.
 */
public interface JobPayload {

    void validate() throws InvalidJobPayloadException;

    /** Number of items the producer asked for, or -1 when the kind has no item list. */
    default int itemCount() {
        return -1;
    }
}
