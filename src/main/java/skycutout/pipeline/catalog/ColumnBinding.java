package skycutout.pipeline.catalog;

import java.util.Objects;
import java.util.Optional;

/**
 * Catalog columns chosen for longitude, latitude and (optionally) the identifier.
 */
public record ColumnBinding(String longitudeColumn, String latitudeColumn, String idColumn) {

    public ColumnBinding {
        Objects.requireNonNull(longitudeColumn, "longitudeColumn is required");
        Objects.requireNonNull(latitudeColumn, "latitudeColumn is required");
    }

    public Optional<String> id() {
        return Optional.ofNullable(idColumn);
    }
}
