package skycutout.pipeline.model;

import java.util.Objects;

/**
 * An observational channel under an instrument, e.g. {@code NISP/NIR-Y}.
 * The cache keeps one directory per band, named by {@link #code()}.
 */
public record Band(Instrument instrument, String code) {

    public Band {
        Objects.requireNonNull(instrument, "instrument is required");
        Objects.requireNonNull(code, "code is required");
        if (!instrument.bandCodes().contains(code)) {
            throw new IllegalArgumentException("Band " + code + " is not observed by " + instrument);
        }
    }

    @Override
    public String toString() {
        return instrument + "/" + code;
    }
}
