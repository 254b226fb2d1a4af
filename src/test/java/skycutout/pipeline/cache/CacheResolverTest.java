package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.Band;
import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.Instrument;
import skycutout.pipeline.model.ProductType;
import skycutout.pipeline.model.SkyPosition;
import skycutout.pipeline.model.Target;
import skycutout.pipeline.model.TargetKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheResolverTest {

    private static final List<Band> BANDS = Instrument.NISP.bands();
    private static final List<ProductType> TYPES = List.of(ProductType.BGSUB, ProductType.RMS);

    @TempDir
    Path dir;

    private CutoutCache cache;
    private CacheResolver resolver;

    @BeforeEach
    void setUp() {
        cache = new CutoutCache(new CacheLayout(dir));
        resolver = new CacheResolver(cache);
    }

    @Test
    void emptyCacheMissesEverything() {
        CacheResolution resolution = resolver.resolve(List.of(target("a"), target("b")), BANDS, TYPES, 128);

        assertEquals(0, resolution.hits().size());
        assertEquals(12, resolution.misses().size());
        assertEquals(12, resolution.total());
    }

    @Test
    void storedArtifactsBecomeHits() throws Exception {
        // 1. First resolution: all misses
        List<Target> targets = List.of(target("a"));
        CacheResolution first = resolver.resolve(targets, BANDS, TYPES, 128);
        assertEquals(6, first.misses().size());

        // 2. Store two of them
        ArtifactRequest stored1 = first.misses().get(0);
        ArtifactRequest stored2 = first.misses().get(3);
        cache.store(stored1, new byte[] { 1 });
        cache.store(stored2, new byte[] { 2 });

        // 3. Second resolution sees them as hits
        CacheResolution second = resolver.resolve(targets, BANDS, TYPES, 128);
        assertEquals(2, second.hits().size());
        assertEquals(4, second.misses().size());
        assertEquals(stored1, second.hits().get(0).request());
        assertFalse(second.misses().contains(stored2));
    }

    @Test
    void hitsAreSharedAcrossCatalogs() throws Exception {
        // Same coordinates without an id in two different catalogs map to the same key
        Target fromCatalogA = new Target(new TargetKey("1500000000020000000"),
                new CatalogRow(0, new SkyPosition(150.0, 2.0), null));
        Target fromCatalogB = new Target(new TargetKey("1500000000020000000"),
                new CatalogRow(7, new SkyPosition(150.0, 2.0), null));

        for (ArtifactRequest miss : resolver.resolve(List.of(fromCatalogA), BANDS, TYPES, 128).misses()) {
            cache.store(miss, new byte[] { 9 });
        }

        CacheResolution resolution = resolver.resolve(List.of(fromCatalogB), BANDS, TYPES, 128);
        assertEquals(6, resolution.hits().size());
        assertTrue(resolution.misses().isEmpty());
    }

    @Test
    void duplicateRowsAreCountedPerRow() {
        CacheResolution resolution = resolver.resolve(
                List.of(target("a"), target("a")), List.of(BANDS.get(0)), List.of(ProductType.FLAG), 32);

        assertEquals(2, resolution.total());
        assertEquals(resolution.misses().get(0), resolution.misses().get(1));
    }

    @Test
    void requiresBandsAndProductTypes() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(List.of(target("a")), List.of(), TYPES, 128));
    }

    private static Target target(String key) {
        return new Target(new TargetKey(key), new CatalogRow(0, new SkyPosition(10.0, 20.0), key));
    }
}
