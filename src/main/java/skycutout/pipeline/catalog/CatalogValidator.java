package skycutout.pipeline.catalog;

import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.CatalogSummary;
import skycutout.pipeline.model.SkyPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link RawCatalog} into typed rows.
 * Any bad row rejects the whole catalog; nothing is scheduled for a partially valid one.
 */
public class CatalogValidator {

    private final int maxRows;

    public CatalogValidator(int maxRows) {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive");
        }
        this.maxRows = maxRows;
    }

    public ValidatedCatalog validate(RawCatalog catalog, ColumnBinding binding) throws CatalogValidationException {
        if (catalog.size() == 0) {
            throw new CatalogValidationException("Catalog contains no rows");
        }
        if (catalog.size() > maxRows) {
            throw new CatalogValidationException(
                    "Catalog has " + catalog.size() + " rows, the limit is " + maxRows);
        }

        List<CatalogRow> rows = new ArrayList<>(catalog.size());
        int withId = 0;
        double minLon = Double.POSITIVE_INFINITY, maxLon = Double.NEGATIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY, maxLat = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < catalog.size(); i++) {
            Map<String, String> raw = catalog.rows().get(i);
            int rowNumber = i + 1;

            double lon = parseCoordinate(raw.get(binding.longitudeColumn()), binding.longitudeColumn(), rowNumber);
            double lat = parseCoordinate(raw.get(binding.latitudeColumn()), binding.latitudeColumn(), rowNumber);
            if (lon < 0.0 || lon > 360.0) {
                throw new CatalogValidationException(
                        "Row " + rowNumber + ": longitude " + lon + " is outside [0, 360]");
            }
            if (lat < -90.0 || lat > 90.0) {
                throw new CatalogValidationException(
                        "Row " + rowNumber + ": latitude " + lat + " is outside [-90, 90]");
            }

            String id = binding.idColumn() == null ? null : checkId(raw.get(binding.idColumn()), rowNumber);
            if (id != null) {
                withId++;
            }

            rows.add(new CatalogRow(i, new SkyPosition(lon, lat), id));
            minLon = Math.min(minLon, lon);
            maxLon = Math.max(maxLon, lon);
            minLat = Math.min(minLat, lat);
            maxLat = Math.max(maxLat, lat);
        }

        CatalogSummary summary = new CatalogSummary(
                rows.size(), withId,
                binding.longitudeColumn(), binding.latitudeColumn(), binding.idColumn(),
                minLon, maxLon, minLat, maxLat);
        return new ValidatedCatalog(rows, summary);
    }

    private static double parseCoordinate(String value, String column, int rowNumber)
            throws CatalogValidationException {
        if (value == null || value.isBlank()) {
            throw new CatalogValidationException("Row " + rowNumber + ": missing value in column " + column);
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new CatalogValidationException(
                    "Row " + rowNumber + ": cannot parse '" + value + "' in column " + column, e);
        }
        if (!Double.isFinite(parsed)) {
            throw new CatalogValidationException(
                    "Row " + rowNumber + ": non-finite value '" + value + "' in column " + column);
        }
        return parsed;
    }

    // Ids become file names in the cache.
    private static String checkId(String value, int rowNumber) throws CatalogValidationException {
        if (value == null || value.isBlank()) {
            return null;
        }
        String id = value.trim();
        if (id.indexOf('/') >= 0 || id.indexOf('\\') >= 0 || id.indexOf('\0') >= 0
                || id.equals(".") || id.equals("..")) {
            throw new CatalogValidationException("Row " + rowNumber + ": identifier '" + id
                    + "' cannot be used as a file name");
        }
        return id;
    }
}
