package mailbox.jobs.app.model;

import lombok.Value;

/**
 * Identifies a mailbox item: its id plus the folder it lives in.
 */
@Value
public class MailItemRef {
    String uid;
    String folder;

    public static MailItemRef of(String uid, String folder) {
        return new MailItemRef(uid, folder);
    }
}
