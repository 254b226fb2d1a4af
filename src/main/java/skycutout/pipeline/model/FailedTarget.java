package skycutout.pipeline.model;

import java.util.Objects;

/**
 * Per-artifact failure record surfaced in the task summary.
 *
 * @param transientFailure whether the cause looked transient (e.g. an archive I/O error);
 *                         informational only, nothing is retried within a task
 */
public record FailedTarget(
        String targetKey,
        String band,
        String productType,
        FailureKind kind,
        String message,
        boolean transientFailure) {

    public FailedTarget {
        Objects.requireNonNull(targetKey, "targetKey is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static FailedTarget of(ArtifactRequest request, FailureKind kind, String message, boolean transientFailure) {
        return new FailedTarget(
                request.targetKey().value(),
                request.band().code(),
                request.productType().code(),
                kind,
                message,
                transientFailure);
    }
}
