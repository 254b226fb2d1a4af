package skycutout.pipeline.scheduler;

import skycutout.pipeline.cache.CutoutCache;
import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.FailureKind;
import skycutout.pipeline.model.ProducedArtifact;
import skycutout.pipeline.producer.ArtifactProducer;
import skycutout.pipeline.producer.ArtifactProductionException;
import skycutout.pipeline.store.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the cache misses of one task on a bounded worker pool.
 *
 * <p>Each call gets its own fixed pool of at most {@code workerCount} threads fed from a
 * queue sized to the work, and returns only after every item was attempted exactly once.
 * A failing item is recorded on the task and never stops its siblings. Successful
 * artifacts are written to the shared cache and returned by cache path; if that write fails
 * the item counts as an error but its bytes are still returned for the current bundle.
 */
public class WorkScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkScheduler.class);

    private final ArtifactProducer producer;
    private final CutoutCache cache;

    public WorkScheduler(ArtifactProducer producer, CutoutCache cache) {
        this.producer = producer;
        this.cache = cache;
    }

    /**
     * Attempt every miss once and block until all are done.
     *
     * @param task        task to report to; must be PROCESSING
     * @param misses      artifacts to produce, duplicates allowed
     * @param workerCount pool size, 1..{@value CutoutRequest#MAX_WORKERS}
     * @return artifacts available for the bundle, by cache path or in memory
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public List<ProducedArtifact> run(TaskRecord task, List<ArtifactRequest> misses, int workerCount)
            throws InterruptedException {
        if (workerCount < 1 || workerCount > CutoutRequest.MAX_WORKERS) {
            throw new IllegalArgumentException(
                    "workerCount must be between 1 and " + CutoutRequest.MAX_WORKERS + ": " + workerCount);
        }

        List<WorkItem> items = WorkItem.group(misses);
        if (items.isEmpty()) {
            log.debug("Task {}: nothing to produce", task.id());
            return List.of();
        }

        int threads = Math.min(workerCount, items.size());
        log.info("Task {}: producing {} artifacts ({} requested) with {} workers",
                task.id(), items.size(), misses.size(), threads);

        ThreadPoolExecutor pool = newPool(task.id(), threads, items.size());
        try {
            List<Callable<ProducedArtifact>> calls = new ArrayList<>(items.size());
            for (WorkItem item : items) {
                calls.add(() -> process(task, item));
            }

            List<ProducedArtifact> produced = new ArrayList<>();
            for (Future<ProducedArtifact> future : pool.invokeAll(calls)) {
                ProducedArtifact artifact = future.get();
                if (artifact != null) {
                    produced.add(artifact);
                }
            }
            return produced;
        } catch (ExecutionException e) {
            // process() records every failure itself, so only an Error gets here
            throw new IllegalStateException("Worker crashed for task " + task.id(), e.getCause());
        } finally {
            shutdown(pool);
        }
    }

    private ProducedArtifact process(TaskRecord task, WorkItem item) {
        ArtifactRequest request = item.request();

        byte[] content;
        try {
            content = producer.produce(request);
            if (content == null || content.length == 0) {
                throw new ArtifactProductionException("producer returned no content");
            }
        } catch (ArtifactProductionException e) {
            log.warn("Task {}: cannot produce {}: {}", task.id(), request, e.getMessage());
            task.recordErrors(item.multiplicity(),
                    FailedTarget.of(request, FailureKind.PRODUCTION, e.getMessage(), e.isTransientFailure()));
            return null;
        } catch (RuntimeException e) {
            log.warn("Task {}: producer crashed on {}", task.id(), request, e);
            task.recordErrors(item.multiplicity(),
                    FailedTarget.of(request, FailureKind.PRODUCTION, String.valueOf(e), false));
            return null;
        }

        Path cachePath;
        try {
            cachePath = cache.store(request, content);
        } catch (IOException | RuntimeException e) {
            log.warn("Task {}: produced {} but could not cache it: {}", task.id(), request, e.getMessage());
            task.recordErrors(item.multiplicity(),
                    FailedTarget.of(request, FailureKind.CACHE_WRITE, e.getMessage(), true));
            return ProducedArtifact.inMemory(request, item.multiplicity(), content);
        }

        task.recordProduced(item.multiplicity());
        log.debug("Task {}: produced {}", task.id(), request);
        return ProducedArtifact.stored(request, item.multiplicity(), cachePath);
    }

    private static ThreadPoolExecutor newPool(String taskId, int threads, int queueCapacity) {
        String prefix = "cutout-" + taskId.substring(0, Math.min(8, taskId.length())) + "-";
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, prefix + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    private static void shutdown(ThreadPoolExecutor pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
