package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.Band;
import skycutout.pipeline.model.CacheEntry;
import skycutout.pipeline.model.ProductType;
import skycutout.pipeline.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Partitions requested artifacts into cache hits and misses.
 *
 * <p>A hit is any existing entry for the same target key, band, product type and size,
 * no matter which task produced it. Existence is checked on disk every time; the
 * resolver keeps no index and takes no locks.
 */
public class CacheResolver {

    private static final Logger log = LoggerFactory.getLogger(CacheResolver.class);

    private final CutoutCache cache;

    public CacheResolver(CutoutCache cache) {
        this.cache = cache;
    }

    public CacheResolution resolve(List<Target> targets, List<Band> bands, List<ProductType> productTypes, int size) {
        if (bands.isEmpty() || productTypes.isEmpty()) {
            throw new IllegalArgumentException("bands and product types must not be empty");
        }

        List<CacheEntry> hits = new ArrayList<>();
        List<ArtifactRequest> misses = new ArrayList<>();

        for (Target target : targets) {
            for (Band band : bands) {
                for (ProductType productType : productTypes) {
                    ArtifactRequest request = ArtifactRequest.of(target, band, productType, size);
                    Optional<CacheEntry> entry = cache.lookup(request);
                    if (entry.isPresent()) {
                        hits.add(entry.get());
                    } else {
                        misses.add(request);
                    }
                }
            }
        }

        log.info("Resolved {} artifacts for {} targets: {} cached, {} to produce",
                hits.size() + misses.size(), targets.size(), hits.size(), misses.size());
        return new CacheResolution(hits, misses);
    }
}
