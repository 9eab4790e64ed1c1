package mailbox.jobs.app.entity;

import java.util.Arrays;

/**
 * Kinds of work the engine knows how to run.
 * The wire value is what producers send and what appears in API responses.
 */
public enum JobKind {
    MAILBOX_SYNC("sync", false),
    TRIAGE_PREVIEW("triage_preview", true),
    BULK_CLEANUP("bulk_cleanup", false),
    TRIAGE_APPLY("triage_apply", false);

    private final String value;
    private final boolean proposal;

    JobKind(String value, boolean proposal) {
        this.value = value;
        this.proposal = proposal;
    }

    public String getValue() {
        return value;
    }

    /**
     * Proposal kinds store candidates and can be approved for a second, executing phase.
     */
    public boolean isProposal() {
        return proposal;
    }

    public static JobKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown job kind: " + value));
    }
}
