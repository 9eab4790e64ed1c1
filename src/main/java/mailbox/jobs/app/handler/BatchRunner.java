package mailbox.jobs.app.handler;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.entity.EventLevel;
import mailbox.jobs.app.scheduler.JobContext;

import java.util.List;
import java.util.Map;

/**
 * Chunked item loop shared by the mutating handlers.
 *
 * <p>Cancellation is checked before every chunk. A failing item is logged and counted and never
 * aborts the chunk. Progress is written once per chunk.</p>
 */
@Slf4j
public class BatchRunner {
    private final int batchSize;

    public BatchRunner(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @FunctionalInterface
    public interface ItemAction<T> {
        void apply(T item) throws Exception;
    }

    @FunctionalInterface
    public interface ChunkListener {
        void afterChunk(int chunkNumber, BatchResult chunk, BatchResult total);
    }

    @Value
    public static class BatchResult {
        int processed;
        int failed;
        boolean cancelled;
    }

    public <T> BatchResult run(JobContext context, List<T> items, ItemAction<T> action, ChunkListener listener) {
        int processed = 0;
        int failed = 0;
        int chunkNumber = 0;

        for (int start = 0; start < items.size(); start += batchSize) {
            if (context.isCancelRequested()) {
                if (context.isOwned()) {
                    log.info("Job {} cancelled after {} of {} items", context.getJobId(), processed + failed, items.size());
                    context.event("Job cancelled by user after " + processed + " items");
                } else {
                    log.warn("Job {} was finished elsewhere; stopping after {} of {} items",
                        context.getJobId(), processed + failed, items.size());
                    context.event(EventLevel.WARN, "Job stopped after " + processed + " items: no longer owned by this worker",
                        Map.of());
                }
                return new BatchResult(processed, failed, true);
            }

            int chunkProcessed = 0;
            int chunkFailed = 0;
            for (T item : items.subList(start, Math.min(start + batchSize, items.size()))) {
                try {
                    action.apply(item);
                    chunkProcessed++;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    chunkFailed++;
                    log.warn("Job {}: interrupted while processing {}", context.getJobId(), item);
                } catch (Exception e) {
                    chunkFailed++;
                    log.warn("Job {}: item {} failed: {}", context.getJobId(), item, e.getMessage());
                }
            }
            processed += chunkProcessed;
            failed += chunkFailed;
            chunkNumber++;

            context.progress(processed, null);
            if (listener != null) {
                listener.afterChunk(chunkNumber,
                    new BatchResult(chunkProcessed, chunkFailed, false),
                    new BatchResult(processed, failed, false));
            }
        }
        return new BatchResult(processed, failed, false);
    }
}
