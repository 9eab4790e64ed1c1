package mailbox.jobs.app.scheduler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.JobStore;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Fails running or executing jobs whose worker stopped refreshing the heartbeat.
 * Reaped jobs are never re-queued: a half-applied mutation batch must not run twice.
 */
@Slf4j
public class StaleJobReaper {
    static final String LEASE_EXPIRED = "Worker lease expired";

    private final JobStore store;
    private final Clock clock;
    private final Duration leaseTimeout;

    public StaleJobReaper(JobStore store, Clock clock, Duration leaseTimeout) {
        this.store = store;
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
    }

    @Scheduled(fixedDelayString = "${jobs.scheduler.reaper-interval-ms:30000}")
    public void reapScheduled() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Error reaping stale jobs: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of jobs failed by this pass
     */
    public int reap() {
        if (leaseTimeout == null || leaseTimeout.isZero() || leaseTimeout.isNegative()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(leaseTimeout);
        int reaped = 0;
        for (MailboxJob job : store.findStaleJobs(cutoff)) {
            if (store.markFinished(job.getId(), JobStatus.FAILED, LEASE_EXPIRED)) {
                store.appendEvent(job.getId(), EventLevel.ERROR, "Job failed: " + LEASE_EXPIRED,
                    Map.of("heartbeat_at", String.valueOf(job.getHeartbeatAt())));
                log.warn("Job {} ({}) failed: no heartbeat since {}",
                    job.getId(), job.getKind().getValue(), job.getHeartbeatAt());
                reaped++;
            }
        }
        return reaped;
    }
}
