package mailbox.jobs.app.classifier;

import mailbox.jobs.app.model.TriageAction;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Triage buckets with the actions suggested for each of them.
 */
public enum TriageCategory {
    ACTION_REQUIRED("action-required", "Needs a reply or a decision from the user", List.of()),
    FYI("fyi", "Informational, worth reading but no action needed", List.of(TriageAction.MARK_READ)),
    NEWSLETTER("newsletter", "Newsletters, digests and marketing mail",
        List.of(TriageAction.MARK_READ, TriageAction.ARCHIVE)),
    NOTIFICATION("notification", "Automated notifications from services and tools",
        List.of(TriageAction.MARK_READ, TriageAction.ARCHIVE)),
    CLEANUP("cleanup", "Safe to archive without reading",
        List.of(TriageAction.MARK_READ, TriageAction.ARCHIVE)),
    UNCLEAR("unclear", "Cannot be classified with confidence", List.of());

    private final String value;
    private final String description;
    private final List<TriageAction> defaultActions;

    TriageCategory(String value, String description, List<TriageAction> defaultActions) {
        this.value = value;
        this.description = description;
        this.defaultActions = defaultActions;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public List<TriageAction> getDefaultActions() {
        return defaultActions;
    }

    /** Unknown or missing values map to {@link #UNCLEAR}. */
    public static TriageCategory fromValue(String value) {
        if (value == null) {
            return UNCLEAR;
        }
        String normalized = value.trim().toLowerCase().replace('_', '-').replace(' ', '-');
        return Arrays.stream(values())
            .filter(category -> category.value.equals(normalized))
            .findFirst()
            .orElse(UNCLEAR);
    }

    /**
     * Mailbox label for a category value: {@code prefix/Title-Case-Value},
     * e.g. {@code Triage/Action-Required}.
     */
    public static String labelFor(String prefix, String category) {
        String title = Arrays.stream(category.split("-"))
            .filter(part -> !part.isEmpty())
            .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
            .collect(Collectors.joining("-"));
        return prefix + "/" + title;
    }
}
