package mailbox.jobs.app.config;

import mailbox.jobs.app.classifier.TriageClassifier;
import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.handler.BatchRunner;
import mailbox.jobs.app.handler.BulkCleanupHandler;
import mailbox.jobs.app.handler.MailboxSyncHandler;
import mailbox.jobs.app.handler.TriageApplyHandler;
import mailbox.jobs.app.handler.TriageExecuteHandler;
import mailbox.jobs.app.handler.TriagePreviewHandler;
import mailbox.jobs.app.mailbox.MailboxConnectionPool;
import mailbox.jobs.app.payload.JobPayloadCodec;
import mailbox.jobs.app.scheduler.JobRoute;
import mailbox.jobs.app.scheduler.JobScheduler;
import mailbox.jobs.app.scheduler.StaleJobReaper;
import mailbox.jobs.app.store.JobStore;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the handlers into the scheduler's dispatch table.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    @ConditionalOnProperty(name = "jobs.scheduler.enabled", havingValue = "true", matchIfMissing = true)
    public JobScheduler jobScheduler(
            JobStore store,
            JobPayloadCodec codec,
            MailboxConnectionPool pool,
            MutationJournal journal,
            MessageCache cache,
            TriageClassifier classifier,
            JobEngineProperties engineProperties,
            MailboxProperties mailboxProperties,
            TriageProperties triageProperties,
            @Qualifier("jobWorkerExecutor") Executor jobWorkerExecutor) {
        JobEngineProperties.Scheduler scheduler = engineProperties.getScheduler();
        BatchRunner batchRunner = new BatchRunner(scheduler.getBatchSize());
        int eventEvery = scheduler.getProgressEventEveryBatches();
        String archiveFolder = mailboxProperties.getArchiveFolder();

        // list order is claim priority
        List<JobRoute> routes = List.of(
            JobRoute.pending(JobKind.MAILBOX_SYNC,
                new MailboxSyncHandler(codec, pool, cache, mailboxProperties),
                "Sync job claimed"),
            JobRoute.pending(JobKind.TRIAGE_PREVIEW,
                new TriagePreviewHandler(codec, cache, classifier, triageProperties),
                "Triage preview job claimed"),
            JobRoute.approved(JobKind.TRIAGE_PREVIEW,
                new TriageExecuteHandler(codec, pool, journal, cache, batchRunner, triageProperties, archiveFolder),
                "Triage execution claimed"),
            JobRoute.pending(JobKind.BULK_CLEANUP,
                new BulkCleanupHandler(codec, pool, journal, cache, batchRunner, eventEvery, triageProperties),
                "Cleanup job claimed"),
            JobRoute.pending(JobKind.TRIAGE_APPLY,
                new TriageApplyHandler(codec, pool, journal, cache, batchRunner, eventEvery, archiveFolder),
                "Triage apply job claimed"));

        return new JobScheduler(store, routes, jobWorkerExecutor,
            scheduler.getMaxConcurrentJobs(), scheduler.getPollInterval());
    }

    @Bean
    public StaleJobReaper staleJobReaper(JobStore store, Clock clock, JobEngineProperties engineProperties) {
        return new StaleJobReaper(store, clock, engineProperties.getScheduler().getLeaseTimeout());
    }
}
