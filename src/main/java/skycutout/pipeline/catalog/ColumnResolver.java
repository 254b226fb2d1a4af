package skycutout.pipeline.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Binds catalog columns by trying a preferred name and then its aliases.
 * Exact matches win over case-insensitive ones.
 */
public class ColumnResolver {

    private static final Logger log = LoggerFactory.getLogger(ColumnResolver.class);

    private final ColumnAliases longitude;
    private final ColumnAliases latitude;
    private final ColumnAliases identifier;

    public ColumnResolver(ColumnAliases longitude, ColumnAliases latitude, ColumnAliases identifier) {
        this.longitude = longitude;
        this.latitude = latitude;
        this.identifier = identifier;
    }

    /**
     * @throws CatalogValidationException if no longitude or latitude candidate is present
     */
    public ColumnBinding resolve(List<String> columns) throws CatalogValidationException {
        String lon = find(columns, longitude)
                .orElseThrow(() -> missing("longitude", longitude, columns));
        String lat = find(columns, latitude)
                .orElseThrow(() -> missing("latitude", latitude, columns));
        String id = identifier == null ? null : find(columns, identifier).orElse(null);

        if (lon.equals(lat)) {
            throw new CatalogValidationException("Longitude and latitude resolve to the same column: " + lon);
        }

        log.info("Using columns: longitude={}, latitude={}, id={}", lon, lat, id);
        return new ColumnBinding(lon, lat, id);
    }

    static Optional<String> find(List<String> columns, ColumnAliases aliases) {
        List<String> candidates = aliases.candidates();
        for (String candidate : candidates) {
            if (columns.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String candidate : candidates) {
            for (String column : columns) {
                if (column.equalsIgnoreCase(candidate)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    private static CatalogValidationException missing(String what, ColumnAliases aliases, List<String> columns) {
        List<String> shown = columns.size() > 10 ? columns.subList(0, 10) : columns;
        return new CatalogValidationException("No " + what + " column found; tried " + aliases.candidates()
                + ", available columns: " + shown);
    }
}
