package skycutout.pipeline.model;

/**
 * Shape of an accepted catalog, kept on the task for status queries.
 */
public record CatalogSummary(
        int rows,
        int rowsWithId,
        String longitudeColumn,
        String latitudeColumn,
        String idColumn,
        double minLongitude,
        double maxLongitude,
        double minLatitude,
        double maxLatitude) {
}
