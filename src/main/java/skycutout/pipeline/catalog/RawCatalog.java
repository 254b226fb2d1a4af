package skycutout.pipeline.catalog;

import java.util.List;
import java.util.Map;

/**
 * Catalog as read from disk: column names in file order and untyped rows.
 * Missing cells are absent from the row map or mapped to null.
 */
public record RawCatalog(List<String> columns, List<Map<String, String>> rows) {

    public RawCatalog {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
