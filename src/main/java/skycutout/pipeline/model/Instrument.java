package skycutout.pipeline.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Archive instruments and the bands each of them observes in.
 */
public enum Instrument {
    VIS(List.of("VIS")),
    NISP(List.of("NIR-Y", "NIR-J", "NIR-H")),
    DECAM(List.of("DES-G", "DES-R", "DES-I", "DES-Z")),
    HSC(List.of("WISHES-G", "WISHES-Z")),
    GPC(List.of("PANSTARRS-I")),
    MEGACAM(List.of("CFIS-U", "CFIS-R"));

    private final List<String> bandCodes;

    Instrument(List<String> bandCodes) {
        this.bandCodes = bandCodes;
    }

    /** Band codes in archive order. */
    public List<String> bandCodes() {
        return bandCodes;
    }

    public List<Band> bands() {
        return bandCodes.stream().map(code -> new Band(this, code)).toList();
    }

    /** Find the band with the given code (case-insensitive) under this instrument. */
    public Optional<Band> band(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return bandCodes.contains(normalized)
                ? Optional.of(new Band(this, normalized))
                : Optional.empty();
    }

    /** Parse an instrument name, case-insensitive. */
    public static Instrument parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("instrument name is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown instrument: " + name);
        }
    }
}
