package mailbox.jobs.app.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote state of an item as observed just before a mutation.
 */
@Value
public class MailItemState {
    String folder;
    boolean unread;
    List<String> labels;

    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("folder", folder);
        snapshot.put("unread", unread);
        snapshot.put("labels", labels);
        return snapshot;
    }
}
