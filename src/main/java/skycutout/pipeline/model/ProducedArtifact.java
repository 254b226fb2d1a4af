package skycutout.pipeline.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A freshly produced artifact on its way to the bundle.
 *
 * <p>Exactly one of {@code cachePath} and {@code content} is set. Once the cache write
 * succeeded only the path is kept and the bundle is filled from the cache file; bytes stay
 * in memory only when the cache could not take them.
 *
 * @param request      what was produced
 * @param multiplicity how many requested artifacts this one stands for
 * @param cachePath    cache file holding the artifact, or {@code null}
 * @param content      artifact bytes when the cache write failed, or {@code null}
 */
public record ProducedArtifact(ArtifactRequest request, int multiplicity, Path cachePath, byte[] content) {

    public ProducedArtifact {
        Objects.requireNonNull(request, "request is required");
        if (multiplicity < 1) {
            throw new IllegalArgumentException("multiplicity must be >= 1: " + multiplicity);
        }
        if ((cachePath == null) == (content == null)) {
            throw new IllegalArgumentException("exactly one of cachePath and content is required");
        }
    }

    public static ProducedArtifact stored(ArtifactRequest request, int multiplicity, Path cachePath) {
        return new ProducedArtifact(request, multiplicity, Objects.requireNonNull(cachePath, "cachePath"), null);
    }

    public static ProducedArtifact inMemory(ArtifactRequest request, int multiplicity, byte[] content) {
        return new ProducedArtifact(request, multiplicity, null, Objects.requireNonNull(content, "content"));
    }

    /** Whether the artifact reached the shared cache. */
    public boolean cached() {
        return cachePath != null;
    }
}
