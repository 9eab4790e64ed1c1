package mailbox.jobs.app.store;

import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailMessage;

import java.util.Collection;
import java.util.List;

/**
 * Local copy of remote folders. Written by sync jobs and by successful mutations, read by triage.
 */
public interface MessageCache {

    void upsert(MailMessage message);

    /**
     * Drops cached rows of the folder whose uid is not in {@code presentUids}.
     * @return number of rows removed
     */
    int retainOnly(String folder, Collection<String> presentUids);

    List<MailMessage> findUnread(String folder, int limit);

    /** Newest first. */
    List<MailMessage> page(String folder, int offset, int limit);

    long count(String folder);

    void markRead(MailItemRef item);

    void remove(MailItemRef item);

    void addLabel(MailItemRef item, String label);

    void removeLabel(MailItemRef item, String label);
}
