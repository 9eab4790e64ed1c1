package mailbox.jobs.app.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle.
 *
 * <pre>
 * pending -> running -> completed | failed
 * pending | completed -> approved -> executing -> completed | failed
 * </pre>
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    APPROVED("approved"),
    EXECUTING("executing");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public Set<JobStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, APPROVED);
            case RUNNING:
            case EXECUTING:
                return EnumSet.of(COMPLETED, FAILED);
            case COMPLETED:
                return EnumSet.of(APPROVED);
            case APPROVED:
                return EnumSet.of(EXECUTING);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }

    /** Owned by a worker. */
    public boolean isActive() {
        return this == RUNNING || this == EXECUTING;
    }

    /** Event streams stop once a job reaches one of these. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Statuses from which a cancellation request is still meaningful. */
    public static Set<JobStatus> cancellable() {
        return EnumSet.of(PENDING, RUNNING, EXECUTING);
    }

    /** Statuses a worker may finish a job from. */
    public static Set<JobStatus> finishable() {
        return EnumSet.of(RUNNING, EXECUTING);
    }

    /** Statuses {@code markApproved} accepts. */
    public static Set<JobStatus> approvable() {
        return EnumSet.of(PENDING, COMPLETED);
    }
}
