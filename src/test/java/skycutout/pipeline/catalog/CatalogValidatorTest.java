package skycutout.pipeline.catalog;

import skycutout.pipeline.model.CatalogSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CatalogValidatorTest {

    private static final ColumnBinding BINDING = new ColumnBinding("RA", "DEC", "ID");

    private final CatalogValidator validator = new CatalogValidator(10);

    @Test
    void validCatalogProducesRowsAndSummary() throws Exception {
        RawCatalog raw = catalog(
                row("150.0", "2.0", "a"),
                row("10.5", "-30.0", " "),
                row("0", "90", null));

        ValidatedCatalog result = validator.validate(raw, BINDING);

        assertEquals(3, result.rows().size());
        assertEquals("a", result.rows().get(0).explicitId());
        assertNull(result.rows().get(1).explicitId());
        assertEquals(2, result.rows().get(2).index());

        CatalogSummary summary = result.summary();
        assertEquals(3, summary.rows());
        assertEquals(1, summary.rowsWithId());
        assertEquals(0.0, summary.minLongitude());
        assertEquals(150.0, summary.maxLongitude());
        assertEquals(-30.0, summary.minLatitude());
        assertEquals(90.0, summary.maxLatitude());
    }

    @Test
    void emptyCatalogIsRejected() {
        assertThrows(CatalogValidationException.class, () -> validator.validate(catalog(), BINDING));
    }

    @Test
    void rowLimitIsEnforced() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            rows.add(row("1.0", "1.0", null));
        }
        RawCatalog raw = new RawCatalog(List.of("RA", "DEC", "ID"), rows);

        CatalogValidationException e = assertThrows(CatalogValidationException.class,
                () -> validator.validate(raw, BINDING));
        assertTrue(e.getMessage().contains("limit"));
    }

    @Test
    void badCoordinatesRejectWholeCatalog() {
        assertRejected("Row 2", row("1.0", "1.0", null), row("abc", "1.0", null));
        assertRejected("non-finite", row("NaN", "1.0", null));
        assertRejected("missing", row("", "1.0", null));
        assertRejected("outside [0, 360]", row("-1.0", "1.0", null));
        assertRejected("outside [-90, 90]", row("10.0", "90.5", null));
    }

    @Test
    void identifiersUnusableAsFileNamesAreRejected() {
        assertRejected("file name", row("1.0", "1.0", "a/b"));
        assertRejected("file name", row("1.0", "1.0", "a\\b"));
        assertRejected("file name", row("1.0", "1.0", ".."));
    }

    @Test
    void catalogWithoutIdColumn() throws Exception {
        ValidatedCatalog result = validator.validate(
                catalog(row("1.0", "1.0", "ignored")), new ColumnBinding("RA", "DEC", null));

        assertTrue(result.rows().get(0).id().isEmpty());
        assertEquals(0, result.summary().rowsWithId());
    }

    @SafeVarargs
    private void assertRejected(String messagePart, Map<String, String>... rows) {
        CatalogValidationException e = assertThrows(CatalogValidationException.class,
                () -> validator.validate(catalog(rows), BINDING));
        assertTrue(e.getMessage().contains(messagePart), e.getMessage());
    }

    @SafeVarargs
    private static RawCatalog catalog(Map<String, String>... rows) {
        return new RawCatalog(List.of("RA", "DEC", "ID"), List.of(rows));
    }

    private static Map<String, String> row(String ra, String dec, String id) {
        Map<String, String> row = new HashMap<>();
        row.put("RA", ra);
        row.put("DEC", dec);
        row.put("ID", id);
        return row;
    }
}
