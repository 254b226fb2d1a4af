package skycutout.pipeline.model;

/**
 * Lifecycle of a catalog submission.
 */
public enum TaskStatus {
    /** Accepted, not started yet */
    QUEUED,
    /** Cache misses are being produced or the bundle is being written */
    PROCESSING,
    /** Bundle written */
    COMPLETED,
    /** Validation, resolution or packaging failed */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Check whether the state machine allows moving from this status to {@code next}. */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
