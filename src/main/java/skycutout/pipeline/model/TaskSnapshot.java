package skycutout.pipeline.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, consistent view of a task at one point in time.
 * Handed out by the task store; never updated in place.
 */
public final class TaskSnapshot {
    private final String id;
    private final TaskStatus status;
    private final int progress;
    private final TaskCounters counters;
    private final String message;
    private final String error;
    private final String catalogPath;
    private final CutoutRequest request;
    private final CatalogSummary catalogSummary;
    private final List<FailedTarget> failedTargets;
    private final Path bundlePath;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private TaskSnapshot(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.counters = Objects.requireNonNull(builder.counters, "counters is required");
        this.message = builder.message;
        this.error = builder.error;
        this.catalogPath = builder.catalogPath;
        this.request = builder.request;
        this.catalogSummary = builder.catalogSummary;
        this.failedTargets = List.copyOf(builder.failedTargets);
        this.bundlePath = builder.bundlePath;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public TaskStatus status() {
        return status;
    }

    /** Progress percentage, 0..100. */
    public int progress() {
        return progress;
    }

    public TaskCounters counters() {
        return counters;
    }

    public String message() {
        return message;
    }

    public String error() {
        return error;
    }

    public String catalogPath() {
        return catalogPath;
    }

    public CutoutRequest request() {
        return request;
    }

    public CatalogSummary catalogSummary() {
        return catalogSummary;
    }

    public List<FailedTarget> failedTargets() {
        return failedTargets;
    }

    /** Bundle location; only set once the task completed. */
    public Path bundlePath() {
        return bundlePath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskStatus status = TaskStatus.QUEUED;
        private int progress;
        private TaskCounters counters = TaskCounters.EMPTY;
        private String message;
        private String error;
        private String catalogPath;
        private CutoutRequest request;
        private CatalogSummary catalogSummary;
        private List<FailedTarget> failedTargets = List.of();
        private Path bundlePath;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder counters(TaskCounters counters) {
            this.counters = counters;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder catalogPath(String catalogPath) {
            this.catalogPath = catalogPath;
            return this;
        }

        public Builder request(CutoutRequest request) {
            this.request = request;
            return this;
        }

        public Builder catalogSummary(CatalogSummary catalogSummary) {
            this.catalogSummary = catalogSummary;
            return this;
        }

        public Builder failedTargets(List<FailedTarget> failedTargets) {
            this.failedTargets = failedTargets;
            return this;
        }

        public Builder bundlePath(Path bundlePath) {
            this.bundlePath = bundlePath;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public TaskSnapshot build() {
            return new TaskSnapshot(this);
        }
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", progress=" + progress + "%, counters=" + counters + "}";
    }
}
