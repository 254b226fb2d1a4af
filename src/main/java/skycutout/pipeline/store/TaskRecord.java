package skycutout.pipeline.store;

import skycutout.pipeline.model.CatalogSummary;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.FailedTarget;
import skycutout.pipeline.model.TaskCounters;
import skycutout.pipeline.model.TaskSnapshot;
import skycutout.pipeline.model.TaskStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The live, mutable state of one task.
 *
 * <p>Every field is guarded by this object's monitor. Workers of the same task report
 * concurrently through the {@code record*} methods; each call is one atomic
 * read-modify-write, and {@link #snapshot()} returns a consistent copy.
 *
 * <p>State machine: QUEUED → PROCESSING → COMPLETED | FAILED, and QUEUED → FAILED.
 * Counters may only move while PROCESSING and {@code total} is fixed on entry to it,
 * so progress never decreases.
 */
public final class TaskRecord {

    private final String id;
    private final String catalogPath;
    private final CutoutRequest request;
    private final Instant createdAt;

    private TaskStatus status = TaskStatus.QUEUED;
    private int total;
    private int cachedHits;
    private int newlyProduced;
    private int errors;
    private int progress;
    private String message;
    private String error;
    private CatalogSummary catalogSummary;
    private final List<FailedTarget> failedTargets = new ArrayList<>();
    private Path bundlePath;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant finishedAt;

    TaskRecord(String id, String catalogPath, CutoutRequest request) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.catalogPath = catalogPath;
        this.request = request;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.message = "Task created, waiting to be processed";
    }

    public String id() {
        return id;
    }

    public CutoutRequest request() {
        return request;
    }

    public synchronized TaskStatus status() {
        return status;
    }

    public synchronized void updateMessage(String message) {
        this.message = message;
        touch();
    }

    public synchronized void recordCatalog(CatalogSummary summary) {
        requireStatus(TaskStatus.QUEUED, "record the catalog");
        this.catalogSummary = summary;
        touch();
    }

    /**
     * Enter PROCESSING with the artifact total fixed and the cache hits already counted.
     */
    public synchronized void startProcessing(int total, int cachedHits) {
        if (total < 0 || cachedHits < 0 || cachedHits > total) {
            throw new IllegalArgumentException("invalid totals: total=" + total + ", cachedHits=" + cachedHits);
        }
        transitionTo(TaskStatus.PROCESSING);
        this.total = total;
        this.cachedHits = cachedHits;
        this.startedAt = Instant.now();
        this.message = "Producing " + (total - cachedHits) + " of " + total + " artifacts";
        recomputeProgress();
    }

    /** Count {@code count} artifacts as freshly produced and cached. */
    public synchronized void recordProduced(int count) {
        requireStatus(TaskStatus.PROCESSING, "record produced artifacts");
        checkCapacity(count);
        newlyProduced += count;
        recomputeProgress();
    }

    /** Count {@code count} artifacts as failed, described by {@code failure}. */
    public synchronized void recordErrors(int count, FailedTarget failure) {
        requireStatus(TaskStatus.PROCESSING, "record errors");
        checkCapacity(count);
        errors += count;
        failedTargets.add(failure);
        recomputeProgress();
    }

    /** A counted hit turned out to be gone when packaging; move it to the errors. */
    public synchronized void reclassifyHitAsError(FailedTarget failure) {
        requireStatus(TaskStatus.PROCESSING, "reclassify a hit");
        if (cachedHits == 0) {
            throw new IllegalStateException("Task " + id + " has no cache hits to reclassify");
        }
        cachedHits--;
        errors++;
        failedTargets.add(failure);
        touch();
    }

    /** A produced artifact's cache file was gone when packaging; move its {@code count} to the errors. */
    public synchronized void reclassifyProducedAsError(int count, FailedTarget failure) {
        requireStatus(TaskStatus.PROCESSING, "reclassify a produced artifact");
        if (count < 1 || count > newlyProduced) {
            throw new IllegalStateException("Task " + id + " cannot reclassify " + count
                    + " of " + newlyProduced + " produced artifacts");
        }
        newlyProduced -= count;
        errors += count;
        failedTargets.add(failure);
        touch();
    }

    public synchronized void complete(Path bundlePath) {
        transitionTo(TaskStatus.COMPLETED);
        this.bundlePath = Objects.requireNonNull(bundlePath, "bundlePath is required");
        this.progress = 100;
        this.finishedAt = Instant.now();
        this.message = errors == 0
                ? "Completed: " + cachedHits + " cached, " + newlyProduced + " produced"
                : "Completed with " + errors + " errors: " + cachedHits + " cached, " + newlyProduced + " produced";
    }

    public synchronized void fail(String error) {
        transitionTo(TaskStatus.FAILED);
        this.error = error;
        this.message = "Failed: " + error;
        this.finishedAt = Instant.now();
    }

    public synchronized TaskSnapshot snapshot() {
        return TaskSnapshot.builder()
                .id(id)
                .status(status)
                .progress(progress)
                .counters(new TaskCounters(total, cachedHits, newlyProduced, errors))
                .message(message)
                .error(error)
                .catalogPath(catalogPath)
                .request(request)
                .catalogSummary(catalogSummary)
                .failedTargets(new ArrayList<>(failedTargets))
                .bundlePath(bundlePath)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    private void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        touch();
    }

    private void requireStatus(TaskStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + action + " for task " + id + " in status " + status);
        }
    }

    private void checkCapacity(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        if (cachedHits + newlyProduced + errors + count > total) {
            throw new IllegalStateException("Task " + id + " would account for more than " + total + " artifacts");
        }
    }

    private void recomputeProgress() {
        int computed = new TaskCounters(total, cachedHits, newlyProduced, errors).progressPercent();
        progress = Math.max(progress, computed);
        touch();
    }

    private void touch() {
        updatedAt = Instant.now();
    }
}
