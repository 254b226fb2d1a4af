package skycutout.pipeline.packaging;

import com.fasterxml.jackson.annotation.JsonProperty;
import skycutout.pipeline.model.TaskCounters;

import java.time.Instant;
import java.util.List;

/**
 * {@code manifest.json} at the root of every bundle.
 */
public record BundleManifest(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("total") int total,
        @JsonProperty("cachedHits") int cachedHits,
        @JsonProperty("newlyProduced") int newlyProduced,
        @JsonProperty("errors") int errors,
        @JsonProperty("artifacts") List<Entry> artifacts) {

    /** Where an artifact in the bundle came from. */
    public enum Source {
        CACHE,
        PRODUCED
    }

    public record Entry(
            @JsonProperty("targetKey") String targetKey,
            @JsonProperty("instrument") String instrument,
            @JsonProperty("band") String band,
            @JsonProperty("productType") String productType,
            @JsonProperty("size") int size,
            @JsonProperty("source") Source source,
            @JsonProperty("path") String path) {
    }

    public static BundleManifest of(String taskId, TaskCounters counters, List<Entry> artifacts) {
        return new BundleManifest(taskId, Instant.now(),
                counters.total(), counters.cachedHits(), counters.newlyProduced(), counters.errors(),
                List.copyOf(artifacts));
    }
}
