package mailbox.jobs.app.handler;

import mailbox.jobs.app.entity.JobKind;
import mailbox.jobs.app.scheduler.JobContext;
import mailbox.jobs.app.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BatchRunnerTest {

    private InMemoryJobStore store;
    private JobContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(Clock.systemUTC());
        store.createJob(JobKind.BULK_CLEANUP, "{}");
        context = new JobContext(store.claimNext(JobKind.BULK_CLEANUP).orElseThrow(), store);
        context.progress(0, 7);
    }

    @Test
    void run_ShouldProcessInChunksAndReportProgressPerChunk() {
        // Given
        List<Integer> items = IntStream.rangeClosed(1, 7).boxed().collect(Collectors.toList());
        List<String> chunks = new ArrayList<>();

        // When
        BatchRunner.BatchResult result = new BatchRunner(3).run(context, items,
            item -> {
                if (item == 5) {
                    throw new IllegalStateException("bad item");
                }
            },
            (chunkNumber, chunk, total) -> chunks.add(chunkNumber + ":" + chunk.getProcessed() + "/" + chunk.getFailed()
                + "=" + total.getProcessed() + "/" + total.getFailed()));

        // Then
        assertEquals(6, result.getProcessed());
        assertEquals(1, result.getFailed());
        assertFalse(result.isCancelled());
        assertEquals(List.of("1:3/0=3/0", "2:2/1=5/1", "3:1/0=6/1"), chunks);
        assertEquals(6, store.getJob(context.getJobId()).orElseThrow().getProcessed());
    }

    @Test
    void run_WhenCancelRequested_ShouldStopBeforeNextChunk() {
        // Given
        List<Integer> items = IntStream.rangeClosed(1, 7).boxed().collect(Collectors.toList());
        List<Integer> seen = new ArrayList<>();

        // When
        BatchRunner.BatchResult result = new BatchRunner(3).run(context, items,
            item -> {
                seen.add(item);
                if (item == 2) {
                    store.requestCancel(context.getJobId());
                }
            },
            null);

        // Then
        assertTrue(result.isCancelled());
        assertEquals(List.of(1, 2, 3), seen);
        assertEquals(3, result.getProcessed());
        assertEquals("Job cancelled by user after 3 items",
            store.listEvents(context.getJobId(), 0, 10).get(0).getMessage());
    }

    @Test
    void constructor_WithZeroBatchSize_ShouldReject() {
        assertThrows(IllegalArgumentException.class, () -> new BatchRunner(0));
    }
}
