package mailbox.jobs.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for job workers and for event stream tailing.
 */
@Configuration
public class AsyncConfig {

    /**
     * Sized to the scheduler's concurrency bound; the scheduler never submits more than that.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor(JobEngineProperties properties) {
        int workers = properties.getScheduler().getMaxConcurrentJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "eventStreamExecutor")
    public Executor eventStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(20);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("job-events-");
        executor.initialize();
        return executor;
    }
}
