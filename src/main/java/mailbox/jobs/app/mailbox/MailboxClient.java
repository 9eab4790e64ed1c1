package mailbox.jobs.app.mailbox;

import mailbox.jobs.app.model.MailItemRef;
import mailbox.jobs.app.model.MailItemState;
import mailbox.jobs.app.model.MessagePage;

import java.io.IOException;
import java.util.List;

/**
 * Mutation and listing primitives of the remote mailbox.
 * Every mutation may throw {@link MailboxConflictException} when the remote item no longer
 * matches what the caller expected (moved, deleted, or relabelled elsewhere).
 */
public interface MailboxClient {

    /**
     * Lists one page of a folder.
     * @param pageToken token from the previous page, null for the first page
     */
    MessagePage listMessages(String folder, String pageToken, int pageSize) throws IOException;

    /** Current remote state of an item. */
    MailItemState fetchState(MailItemRef item) throws IOException;

    void markRead(MailItemRef item) throws IOException;

    void markUnread(MailItemRef item) throws IOException;

    void move(MailItemRef item, String destination) throws IOException;

    void addLabels(MailItemRef item, List<String> labels) throws IOException;

    void removeLabels(MailItemRef item, List<String> labels) throws IOException;
}
