package mailbox.jobs.app.mailbox;

/**
 * Mutation names as written to the mutation journal.
 */
public enum MailboxOperation {
    MARK_READ("mark_read"),
    MARK_UNREAD("mark_unread"),
    MOVE("move"),
    ADD_LABELS("add_labels"),
    REMOVE_LABELS("remove_labels");

    private final String value;

    MailboxOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
