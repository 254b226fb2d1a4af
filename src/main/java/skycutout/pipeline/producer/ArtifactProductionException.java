package skycutout.pipeline.producer;

/**
 * A single artifact could not be produced. Never fatal to the batch.
 */
public class ArtifactProductionException extends Exception {

    private final boolean transientFailure;

    public ArtifactProductionException(String message) {
        this(message, false, null);
    }

    public ArtifactProductionException(String message, boolean transientFailure) {
        this(message, transientFailure, null);
    }

    public ArtifactProductionException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /** Whether the cause looked transient, e.g. an archive read error rather than out-of-coverage. */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
