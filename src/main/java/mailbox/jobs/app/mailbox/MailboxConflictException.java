package mailbox.jobs.app.mailbox;

/**
 * The remote item's state no longer matches what the caller expected. Item-level, never retried.
 */
public class MailboxConflictException extends RuntimeException {
    public MailboxConflictException(String message) {
        super(message);
    }

    public MailboxConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
