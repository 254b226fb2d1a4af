package skycutout.pipeline.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A validated catalog row.
 *
 * @param index      zero-based position in the catalog
 * @param position   sky position
 * @param explicitId catalog identifier, or null when the row has none
 */
public record CatalogRow(int index, SkyPosition position, String explicitId) {

    public CatalogRow {
        Objects.requireNonNull(position, "position is required");
        if (explicitId != null && explicitId.isBlank()) {
            explicitId = null;
        }
    }

    public Optional<String> id() {
        return Optional.ofNullable(explicitId);
    }
}
