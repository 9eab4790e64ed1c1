package mailbox.jobs.app.model;

import lombok.Value;

import java.util.List;

@Value
public class MessagePage {
    List<MailMessage> messages;
    // null when the folder has been fully listed
    String nextPageToken;

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
