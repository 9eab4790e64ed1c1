package mailbox.jobs.app.scheduler;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.entity.JobStatus;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.store.JobStore;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Polls the job store for claimable work and hands each claimed job to the worker pool.
 *
 * <p>Routes are tried in list order, which is the claim priority. At most
 * {@code maxConcurrentJobs} jobs are in flight; when nothing could be started the loop sleeps
 * for the poll interval.</p>
 */
@Slf4j
public class JobScheduler implements SmartLifecycle {
    private final JobStore store;
    private final List<JobRoute> routes;
    private final Executor workerExecutor;
    private final int maxConcurrentJobs;
    private final Duration pollInterval;

    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean running;
    private Thread loopThread;

    public JobScheduler(JobStore store, List<JobRoute> routes, Executor workerExecutor,
                        int maxConcurrentJobs, Duration pollInterval) {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1");
        }
        this.store = store;
        this.routes = List.copyOf(routes);
        this.workerExecutor = workerExecutor;
        this.maxConcurrentJobs = maxConcurrentJobs;
        this.pollInterval = pollInterval;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "job-scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Job scheduler started: {} routes, max {} concurrent jobs, poll every {}ms",
            routes.size(), maxConcurrentJobs, pollInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        loopThread.interrupt();
        try {
            loopThread.join(pollInterval.toMillis() + 5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Job scheduler stopped with {} jobs still in flight", activeJobs());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            int started = pollOnce();
            if (started == 0) {
                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * One scheduling pass: reaps finished workers, then claims jobs in route order until the
     * concurrency bound is reached or every queue is empty.
     * @return number of jobs started
     */
    public int pollOnce() {
        inFlight.removeIf(CompletableFuture::isDone);
        int started = 0;
        for (JobRoute route : routes) {
            while (inFlight.size() < maxConcurrentJobs) {
                Optional<MailboxJob> claimed;
                try {
                    claimed = route.claim(store);
                } catch (RuntimeException e) {
                    log.error("Error claiming {} job: {}", route.describe(), e.getMessage(), e);
                    break;
                }
                if (claimed.isEmpty()) {
                    break;
                }
                dispatch(route, claimed.get());
                started++;
            }
        }
        if (started > 0) {
            log.debug("Started {} jobs, {} in flight", started, inFlight.size());
        }
        return started;
    }

    public int activeJobs() {
        inFlight.removeIf(CompletableFuture::isDone);
        return inFlight.size();
    }

    private void dispatch(JobRoute route, MailboxJob job) {
        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(new JobWorker(store, route, job), workerExecutor);
            inFlight.add(future);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {} ({}): {}", job.getId(), route.describe(), e.getMessage());
            String error = "Worker pool rejected job";
            try {
                store.appendEvent(job.getId(), EventLevel.ERROR, "Job failed: " + error, Map.of());
                store.markFinished(job.getId(), JobStatus.FAILED, error);
            } catch (RuntimeException storeError) {
                log.error("Could not fail rejected job {}: {}", job.getId(), storeError.getMessage(), storeError);
            }
        }
    }
}
