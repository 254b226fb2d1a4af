package skycutout.pipeline.model;

import java.util.Objects;

/**
 * Canonical identity of a catalog target.
 * Either the catalog author's identifier or a key derived from the coordinates.
 */
public record TargetKey(String value) {

    public TargetKey {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("target key must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
