package mailbox.jobs.app.model;

import mailbox.jobs.app.exception.InvalidJobPayloadException;

import java.util.Arrays;

/**
 * Actions a reviewer or a classifier can attach to an item.
 */
public enum TriageAction {
    MARK_READ("mark_read"),
    ARCHIVE("archive"),
    ADD_LABEL("add_label");

    private final String value;

    TriageAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TriageAction fromValue(String value) {
        return Arrays.stream(values())
            .filter(action -> action.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidJobPayloadException("Unknown action: " + value));
    }
}
