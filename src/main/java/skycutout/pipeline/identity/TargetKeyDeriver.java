package skycutout.pipeline.identity;

import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.TargetKey;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Derives the canonical {@link TargetKey} of a catalog row.
 *
 * <p>An explicit identifier wins (trimmed, otherwise verbatim). Without one the key is a
 * fixed-width encoding of the coordinates: longitude as 3 integer + 7 fractional digits,
 * |latitude| as 2 integer + 7 fractional digits, decimal points stripped and concatenated,
 * with a leading {@code -} for southern latitudes. Example: (150.0, 2.0) gives
 * {@code 1500000000020000000}.
 *
 * <p>Values are rounded half-up on their shortest decimal representation, so the same
 * double always yields the same digits. The sign follows the rounded latitude: a value
 * such as {@code -0.00000001} rounds to zero and gets no {@code -}.
 */
public final class TargetKeyDeriver {

    static final int FRACTION_DIGITS = 7;

    private static final BigDecimal FULL_CIRCLE = BigDecimal.valueOf(360);
    private static final BigDecimal POLE = BigDecimal.valueOf(90);

    private TargetKeyDeriver() {
    }

    public static TargetKey derive(CatalogRow row) {
        return derive(row.explicitId(), row.position().longitude(), row.position().latitude());
    }

    /**
     * @param explicitId catalog identifier, may be null or blank
     * @param longitude  decimal degrees, any finite value (reduced modulo 360)
     * @param latitude   decimal degrees in [-90, 90]
     */
    public static TargetKey derive(String explicitId, double longitude, double latitude) {
        if (explicitId != null && !explicitId.isBlank()) {
            return new TargetKey(explicitId.trim());
        }
        return new TargetKey(encode(longitude, latitude));
    }

    static String encode(double longitude, double latitude) {
        if (!Double.isFinite(longitude) || !Double.isFinite(latitude)) {
            throw new IllegalArgumentException(
                    "Cannot derive a key from non-finite coordinates (" + longitude + ", " + latitude + ")");
        }

        BigDecimal lon = round(reduceLongitude(longitude));
        // 359.99999996 rounds up to the full circle
        if (lon.compareTo(FULL_CIRCLE) >= 0) {
            lon = lon.subtract(FULL_CIRCLE);
        }

        BigDecimal lat = round(latitude);
        if (lat.abs().compareTo(POLE) > 0) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }

        String lonDigits = String.format(Locale.ROOT, "%010d", lon.unscaledValue().longValueExact());
        String latDigits = String.format(Locale.ROOT, "%09d", lat.abs().unscaledValue().longValueExact());

        String key = lonDigits + latDigits;
        return lat.signum() < 0 ? "-" + key : key;
    }

    private static double reduceLongitude(double longitude) {
        double reduced = longitude % 360.0;
        return reduced < 0 ? reduced + 360.0 : reduced;
    }

    private static BigDecimal round(double value) {
        return BigDecimal.valueOf(value).setScale(FRACTION_DIGITS, RoundingMode.HALF_UP);
    }
}
