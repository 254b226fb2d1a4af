package skycutout.pipeline.model;

import java.util.Objects;

/**
 * A catalog row paired with its derived identity.
 */
public record Target(TargetKey key, CatalogRow row) {

    public Target {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(row, "row is required");
    }

    public SkyPosition position() {
        return row.position();
    }
}
