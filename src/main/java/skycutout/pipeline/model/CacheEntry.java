package skycutout.pipeline.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An artifact already materialized in the shared cache.
 */
public record CacheEntry(ArtifactRequest request, Path path) {

    public CacheEntry {
        Objects.requireNonNull(request, "request is required");
        Objects.requireNonNull(path, "path is required");
    }
}
