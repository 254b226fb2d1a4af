package skycutout.pipeline.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Preferred column name followed by an ordered list of fallbacks.
 */
public record ColumnAliases(String preferred, List<String> aliases) {

    public static final ColumnAliases LONGITUDE = new ColumnAliases("RA", List.of(
            "TARGET_RA", "RA_1", "RA_2", "RA_DEG", "ALPHA_J2000", "ALPHAWIN_J2000",
            "RightAscension", "RIGHT_ASCENSION"));

    public static final ColumnAliases LATITUDE = new ColumnAliases("DEC", List.of(
            "TARGET_DEC", "DEC_1", "DEC_2", "DEC_DEG", "DELTA_J2000", "DELTAWIN_J2000",
            "Declination", "DECLINATION"));

    public static final ColumnAliases IDENTIFIER = new ColumnAliases("TARGETID", List.of(
            "TARGET_ID", "ID", "SOURCE_ID", "NUMBER", "OBJECT_ID"));

    public ColumnAliases {
        Objects.requireNonNull(preferred, "preferred is required");
        aliases = List.copyOf(aliases);
    }

    /** Same aliases with a different preferred name; the old one becomes the first fallback. */
    public ColumnAliases preferring(String name) {
        if (name == null || name.isBlank() || name.equals(preferred)) {
            return this;
        }
        List<String> fallbacks = new ArrayList<>();
        fallbacks.add(preferred);
        fallbacks.addAll(aliases);
        fallbacks.remove(name);
        return new ColumnAliases(name, fallbacks);
    }

    /** Preferred name first, then the aliases. */
    public List<String> candidates() {
        List<String> all = new ArrayList<>(aliases.size() + 1);
        all.add(preferred);
        all.addAll(aliases);
        return all;
    }
}
