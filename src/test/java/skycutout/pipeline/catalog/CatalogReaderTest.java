package skycutout.pipeline.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogReaderTest {

    @TempDir
    Path dir;

    private final CatalogReader reader = new CatalogReader();

    @Test
    void readsCsvWithHeader() throws Exception {
        Path file = dir.resolve("targets.csv");
        Files.writeString(file, """
                TARGETID,RA,DEC
                obj-1, 150.0 ,2.0

                obj-2,151.5,-3.25
                """);

        RawCatalog catalog = reader.read(file);

        assertEquals(List.of("TARGETID", "RA", "DEC"), catalog.columns());
        assertEquals(2, catalog.size());
        assertEquals("obj-1", catalog.rows().get(0).get("TARGETID"));
        assertEquals("150.0", catalog.rows().get(0).get("RA"));
        assertEquals("-3.25", catalog.rows().get(1).get("DEC"));
    }

    @Test
    void readsJsonArray() throws Exception {
        Path file = dir.resolve("targets.json");
        Files.writeString(file, """
                [
                  {"RA": 150.0, "DEC": 2.0, "ID": "a"},
                  {"RA": 10.5, "DEC": -1.0, "ID": null, "MAG": 21.3}
                ]
                """);

        RawCatalog catalog = reader.read(file);

        assertEquals(List.of("RA", "DEC", "ID", "MAG"), catalog.columns());
        assertEquals(2, catalog.size());
        assertEquals("150.0", catalog.rows().get(0).get("RA"));
        assertNull(catalog.rows().get(1).get("ID"));
    }

    @Test
    void rejectsJsonThatIsNotAnArrayOfObjects() throws Exception {
        Path object = dir.resolve("object.json");
        Files.writeString(object, "{\"RA\": 1.0}");
        Path scalars = dir.resolve("scalars.json");
        Files.writeString(scalars, "[1, 2, 3]");

        assertThrows(CatalogValidationException.class, () -> reader.read(object));
        assertThrows(CatalogValidationException.class, () -> reader.read(scalars));
    }

    @Test
    void rejectsUnsupportedExtension() throws Exception {
        Path file = dir.resolve("targets.fits");
        Files.writeString(file, "SIMPLE = T");

        CatalogValidationException e = assertThrows(CatalogValidationException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("Unsupported"));
    }

    @Test
    void rejectsMissingFile() {
        assertThrows(CatalogValidationException.class, () -> reader.read(dir.resolve("nope.csv")));
    }
}
