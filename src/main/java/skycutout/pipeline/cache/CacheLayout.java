package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.Band;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk naming of the shared cutout cache.
 *
 * <pre>
 * {root}/{band code}/{target key}_{product token}_{size}.fits
 * e.g. cache/NIR-Y/1500000000020000000_BGSUB_128.fits
 * </pre>
 *
 * Existence of an artifact is decided by building its path, never by scanning.
 */
public final class CacheLayout {

    public static final String EXTENSION = ".fits";

    private final Path root;

    public CacheLayout(Path root) {
        this.root = Objects.requireNonNull(root, "root is required").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path bandDirectory(Band band) {
        return root.resolve(band.code());
    }

    public static String fileName(ArtifactRequest request) {
        return request.targetKey().value()
                + "_" + request.productType().fileToken()
                + "_" + request.size()
                + EXTENSION;
    }

    public Path pathOf(ArtifactRequest request) {
        return bandDirectory(request.band()).resolve(fileName(request));
    }
}
