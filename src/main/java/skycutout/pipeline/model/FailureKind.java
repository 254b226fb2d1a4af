package skycutout.pipeline.model;

/**
 * Why a single artifact is missing from, or degraded in, a task's result.
 */
public enum FailureKind {
    /** The producer could not make the artifact */
    PRODUCTION,
    /** The artifact was produced but could not be stored in the cache */
    CACHE_WRITE,
    /** A cache entry counted for the task disappeared before it could be packaged */
    MISSING_HIT
}
