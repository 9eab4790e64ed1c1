package mailbox.jobs.app.entity;

public enum EventLevel {
    DEBUG, INFO, WARN, ERROR;

    public String getValue() {
        return name().toLowerCase();
    }
}
