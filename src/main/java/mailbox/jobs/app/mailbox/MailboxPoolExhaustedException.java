package mailbox.jobs.app.mailbox;

/**
 * No mailbox connection became available within the acquire timeout. Fails the whole job.
 */
public class MailboxPoolExhaustedException extends RuntimeException {
    public MailboxPoolExhaustedException(String message) {
        super(message);
    }
}
