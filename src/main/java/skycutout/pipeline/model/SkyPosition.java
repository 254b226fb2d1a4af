package skycutout.pipeline.model;

/**
 * Sky coordinates in decimal degrees.
 */
public record SkyPosition(double longitude, double latitude) {

    public SkyPosition {
        if (!Double.isFinite(longitude) || !Double.isFinite(latitude)) {
            throw new IllegalArgumentException(
                    "Coordinates must be finite: (" + longitude + ", " + latitude + ")");
        }
    }

    @Override
    public String toString() {
        return "(" + longitude + ", " + latitude + ")";
    }
}
