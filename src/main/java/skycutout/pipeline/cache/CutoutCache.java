package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * The shared, durable artifact cache.
 *
 * <p>No locking: any number of tasks (and processes) read and write concurrently.
 * Entries are written to a temporary file in the band directory and moved into place,
 * so readers never observe a partial file. Two producers racing on the same entry
 * write identical content and the last move wins.
 */
public class CutoutCache {

    private static final Logger log = LoggerFactory.getLogger(CutoutCache.class);

    private final CacheLayout layout;

    public CutoutCache(CacheLayout layout) {
        this.layout = layout;
    }

    public CacheLayout layout() {
        return layout;
    }

    /**
     * Look up an artifact by direct path construction.
     * Empty files are treated as absent.
     */
    public Optional<CacheEntry> lookup(ArtifactRequest request) {
        Path path = layout.pathOf(request);
        try {
            if (Files.isRegularFile(path) && Files.size(path) > 0) {
                return Optional.of(new CacheEntry(request, path));
            }
        } catch (IOException e) {
            // vanished between the two checks
            log.debug("Cache entry {} not readable: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Store artifact content, replacing any existing entry.
     *
     * @return path of the cache entry
     * @throws IOException if the entry could not be written
     */
    public Path store(ArtifactRequest request, byte[] content) throws IOException {
        Path target = layout.pathOf(request);
        Path dir = target.getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, ".part-", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.debug("Cached {} -> {}", request, target);
        return target;
    }
}
