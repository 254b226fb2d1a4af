package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.CacheEntry;

import java.util.List;

/**
 * Requested artifacts split into those already cached and those to produce.
 * One element per (catalog row, band, product type); rows sharing a key are not merged here.
 */
public record CacheResolution(List<CacheEntry> hits, List<ArtifactRequest> misses) {

    public CacheResolution {
        hits = List.copyOf(hits);
        misses = List.copyOf(misses);
    }

    public int total() {
        return hits.size() + misses.size();
    }
}
