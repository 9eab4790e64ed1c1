package mailbox.jobs.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Scheduler, store and event stream settings.
 */
@Data
@ConfigurationProperties(prefix = "jobs")
public class JobEngineProperties {

    /** {@code jpa} (Postgres) or {@code memory}. */
    private String store = "jpa";

    private Scheduler scheduler = new Scheduler();

    private Events events = new Events();

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        private int maxConcurrentJobs = 3;

        /** Sleep between polls when no job could be claimed. */
        private Duration pollInterval = Duration.ofSeconds(1);

        /** Items per chunk in batch jobs; cancellation is checked between chunks. */
        private int batchSize = 10;

        /** Summary event cadence for bulk cleanup and triage apply, in chunks. */
        private int progressEventEveryBatches = 5;

        /** Heartbeat age after which a running job is failed. Zero disables the reaper. */
        private Duration leaseTimeout = Duration.ZERO;
    }

    @Data
    public static class Events {
        private Duration streamPollInterval = Duration.ofMillis(750);

        private int pageSize = 200;
    }
}
