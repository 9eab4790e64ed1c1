package mailbox.jobs.app.model;

/**
 * Review buckets for classifier confidence. Only {@link #HIGH} items are auto-applied.
 */
public enum ConfidenceBucket {
    HIGH("high_confidence"),
    MEDIUM("medium_confidence"),
    LOW("low_confidence");

    public static final double HIGH_THRESHOLD = 0.90;
    public static final double MEDIUM_THRESHOLD = 0.50;

    private final String value;

    ConfidenceBucket(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ConfidenceBucket of(double confidence) {
        if (confidence >= HIGH_THRESHOLD) {
            return HIGH;
        }
        return confidence >= MEDIUM_THRESHOLD ? MEDIUM : LOW;
    }
}
