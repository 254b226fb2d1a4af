package skycutout.pipeline.model;

/**
 * Artifact counters of a task. {@code total} is fixed when the task starts processing.
 */
public record TaskCounters(int total, int cachedHits, int newlyProduced, int errors) {

    public static final TaskCounters EMPTY = new TaskCounters(0, 0, 0, 0);

    public TaskCounters {
        if (total < 0 || cachedHits < 0 || newlyProduced < 0 || errors < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
    }

    /** Artifacts accounted for so far. */
    public int processed() {
        return cachedHits + newlyProduced + errors;
    }

    /** {@code round(100 * processed / total)}, 100 for an empty task. */
    public int progressPercent() {
        if (total == 0)
            return 100;
        return (int) Math.round(100.0 * processed() / total);
    }

    public boolean hasErrors() {
        return errors > 0;
    }
}
