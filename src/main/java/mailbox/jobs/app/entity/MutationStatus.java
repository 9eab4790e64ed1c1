package mailbox.jobs.app.entity;

public enum MutationStatus {
    PENDING, APPLIED, FAILED;

    public String getValue() {
        return name().toLowerCase();
    }
}
