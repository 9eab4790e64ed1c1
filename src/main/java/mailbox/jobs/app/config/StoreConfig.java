package mailbox.jobs.app.config;

import mailbox.jobs.app.repository.CachedMessageRepository;
import mailbox.jobs.app.repository.JobCandidateRepository;
import mailbox.jobs.app.repository.JobEventRepository;
import mailbox.jobs.app.repository.MailboxJobRepository;
import mailbox.jobs.app.repository.MutationRecordRepository;
import mailbox.jobs.app.store.InMemoryJobStore;
import mailbox.jobs.app.store.InMemoryMessageCache;
import mailbox.jobs.app.store.InMemoryMutationJournal;
import mailbox.jobs.app.store.JobStore;
import mailbox.jobs.app.store.JpaJobStore;
import mailbox.jobs.app.store.JpaMessageCache;
import mailbox.jobs.app.store.JpaMutationJournal;
import mailbox.jobs.app.store.MessageCache;
import mailbox.jobs.app.store.MutationJournal;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Selects the store backend. Set jobs.store=jpa (default, Postgres) or jobs.store=memory.
 * The memory backend needs the DataSource and JPA auto-configuration excluded; see application-memory.properties.
 */
@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration
    @ConditionalOnProperty(name = "jobs.store", havingValue = "jpa", matchIfMissing = true)
    static class JpaStoreConfig {

        @Bean
        public JobStore jobStore(MailboxJobRepository jobRepository, JobEventRepository eventRepository,
                                 JobCandidateRepository candidateRepository, Clock clock) {
            return new JpaJobStore(jobRepository, eventRepository, candidateRepository, clock);
        }

        @Bean
        public MutationJournal mutationJournal(MutationRecordRepository repository, Clock clock) {
            return new JpaMutationJournal(repository, clock);
        }

        @Bean
        public MessageCache messageCache(CachedMessageRepository repository, Clock clock) {
            return new JpaMessageCache(repository, clock);
        }

        @Bean
        public TransactionOperations transactionOperations(PlatformTransactionManager transactionManager) {
            return new TransactionTemplate(transactionManager);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "jobs.store", havingValue = "memory")
    static class MemoryStoreConfig {

        @Bean
        public JobStore jobStore(Clock clock) {
            return new InMemoryJobStore(clock);
        }

        @Bean
        public MutationJournal mutationJournal(Clock clock) {
            return new InMemoryMutationJournal(clock);
        }

        @Bean
        public MessageCache messageCache() {
            return new InMemoryMessageCache();
        }

        @Bean
        public TransactionOperations transactionOperations() {
            return TransactionOperations.withoutTransaction();
        }
    }
}
