package mailbox.jobs.app.service;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.config.JobEngineProperties;
import mailbox.jobs.app.dto.JobEventView;
import mailbox.jobs.app.dto.JobStatusFrame;
import mailbox.jobs.app.entity.JobEvent;
import mailbox.jobs.app.entity.MailboxJob;
import mailbox.jobs.app.exception.EventStreamUnavailableException;
import mailbox.jobs.app.exception.JobNotFoundException;
import mailbox.jobs.app.store.JobStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tails a job's event log for a client. Each poll sends the new events in id order followed by
 * a status frame; the stream ends once the job reaches a terminal status.
 */
@Slf4j
@Service
public class JobEventStreamService {
    public static final String EVENT_FRAME = "job_event";
    public static final String STATUS_FRAME = "job_status";

    /**
     * Destination of stream frames. Returning normally means the frame was delivered.
     */
    @FunctionalInterface
    public interface JobEventSink {
        void send(String frameName, Object frame) throws IOException;
    }

    private final JobStore store;
    private final JobEngineProperties properties;
    private final Executor streamExecutor;

    public JobEventStreamService(JobStore store, JobEngineProperties properties,
                                 @Qualifier("eventStreamExecutor") Executor streamExecutor) {
        this.store = store;
        this.properties = properties;
        this.streamExecutor = streamExecutor;
    }

    public SseEmitter open(String jobId, long afterId) {
        if (store.getJob(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean open = new AtomicBoolean(true);
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> open.set(false));
        emitter.onError(e -> open.set(false));

        try {
            streamExecutor.execute(() -> tail(jobId, afterId, emitter, open));
        } catch (RejectedExecutionException e) {
            log.warn("Event stream pool is full, refusing stream for job {}", jobId);
            throw new EventStreamUnavailableException(jobId, e);
        }
        return emitter;
    }

    private void tail(String jobId, long afterId, SseEmitter emitter, AtomicBoolean open) {
        try {
            stream(jobId, afterId, open,
                (name, frame) -> emitter.send(SseEmitter.event().name(name).data(frame)));
            emitter.complete();
        } catch (IOException e) {
            log.debug("Event stream for job {} closed by client: {}", jobId, e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } catch (RuntimeException e) {
            log.error("Event stream for job {} failed: {}", jobId, e.getMessage(), e);
            emitter.completeWithError(e);
        }
    }

    /**
     * Streams until the job is terminal or the client goes away.
     * @return id of the last event delivered
     */
    public long stream(String jobId, long afterId, AtomicBoolean open, JobEventSink sink)
            throws IOException, InterruptedException {
        long lastId = afterId;
        while (open.get()) {
            lastId = drain(jobId, lastId, sink);

            MailboxJob job = store.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            sink.send(STATUS_FRAME, JobStatusFrame.of(job));
            if (job.getStatus().isTerminal()) {
                // events appended between the drain and the status read
                return drain(jobId, lastId, sink);
            }
            Thread.sleep(properties.getEvents().getStreamPollInterval().toMillis());
        }
        return lastId;
    }

    private long drain(String jobId, long afterId, JobEventSink sink) throws IOException {
        long lastId = afterId;
        int pageSize = properties.getEvents().getPageSize();
        List<JobEvent> page;
        do {
            page = store.listEvents(jobId, lastId, pageSize);
            for (JobEvent event : page) {
                sink.send(EVENT_FRAME, JobEventView.of(event));
                lastId = event.getId();
            }
        } while (page.size() == pageSize);
        return lastId;
    }
}
