package skycutout.pipeline.cache;

import skycutout.pipeline.model.ArtifactRequest;
import skycutout.pipeline.model.Band;
import skycutout.pipeline.model.CacheEntry;
import skycutout.pipeline.model.Instrument;
import skycutout.pipeline.model.ProductType;
import skycutout.pipeline.model.SkyPosition;
import skycutout.pipeline.model.TargetKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CutoutCacheTest {

    @TempDir
    Path dir;

    private CacheLayout layout;
    private CutoutCache cache;

    @BeforeEach
    void setUp() {
        layout = new CacheLayout(dir.resolve("cache"));
        cache = new CutoutCache(layout);
    }

    @Test
    void pathIsBuiltFromArtifactIdentity() {
        ArtifactRequest request = request("1500000000020000000", ProductType.CATALOG_PSF, 128);

        assertEquals("1500000000020000000_CATALOG_PSF_128.fits", CacheLayout.fileName(request));
        assertEquals(layout.root().resolve("NIR-Y").resolve("1500000000020000000_CATALOG_PSF_128.fits"),
                layout.pathOf(request));
    }

    @Test
    void lookupMissesUntilStored() throws Exception {
        ArtifactRequest request = request("obj-1", ProductType.BGSUB, 64);
        assertTrue(cache.lookup(request).isEmpty());

        Path stored = cache.store(request, "pixels".getBytes(StandardCharsets.US_ASCII));

        Optional<CacheEntry> entry = cache.lookup(request);
        assertTrue(entry.isPresent());
        assertEquals(stored, entry.get().path());
        assertEquals("pixels", Files.readString(stored));
    }

    @Test
    void differentSizeIsADifferentEntry() throws Exception {
        cache.store(request("obj-1", ProductType.BGSUB, 64), new byte[] { 1 });

        assertTrue(cache.lookup(request("obj-1", ProductType.BGSUB, 128)).isEmpty());
        assertTrue(cache.lookup(request("obj-1", ProductType.RMS, 64)).isEmpty());
    }

    @Test
    void emptyFileIsTreatedAsMissing() throws Exception {
        ArtifactRequest request = request("obj-1", ProductType.FLAG, 64);
        Path path = layout.pathOf(request);
        Files.createDirectories(path.getParent());
        Files.createFile(path);

        assertTrue(cache.lookup(request).isEmpty());
    }

    @Test
    void storeReplacesExistingEntryAndLeavesNoTempFiles() throws Exception {
        ArtifactRequest request = request("obj-1", ProductType.BGMOD, 64);
        cache.store(request, new byte[] { 1, 2 });
        cache.store(request, new byte[] { 3, 4, 5 });

        assertArrayEquals(new byte[] { 3, 4, 5 }, Files.readAllBytes(layout.pathOf(request)));
        try (Stream<Path> files = Files.list(layout.bandDirectory(request.band()))) {
            assertEquals(1, files.count());
        }
    }

    private static ArtifactRequest request(String key, ProductType type, int size) {
        return new ArtifactRequest(new TargetKey(key), new SkyPosition(150.0, 2.0),
                new Band(Instrument.NISP, "NIR-Y"), type, size);
    }
}
