package skycutout.pipeline.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What a submission asks for: instruments, bands, product types, cutout size and
 * worker count, plus optional catalog column preferences.
 * Immutable; built with {@link #builder()}. Repeated instruments, bands and product types
 * are kept once, in first-seen order.
 */
public final class CutoutRequest {

    public static final int DEFAULT_WORKERS = 4;
    public static final int MAX_WORKERS = 16;

    private final List<Instrument> instruments;
    private final List<String> bands;
    private final List<ProductType> productTypes;
    private final int size;
    private final int workers;
    private final String longitudeColumn;
    private final String latitudeColumn;
    private final String idColumn;

    private CutoutRequest(Builder builder) {
        if (builder.instruments.isEmpty()) {
            throw new IllegalArgumentException("at least one instrument is required");
        }
        if (builder.productTypes.isEmpty()) {
            throw new IllegalArgumentException("at least one product type is required");
        }
        if (builder.size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + builder.size);
        }
        if (builder.workers < 1 || builder.workers > MAX_WORKERS) {
            throw new IllegalArgumentException(
                    "workers must be between 1 and " + MAX_WORKERS + ": " + builder.workers);
        }
        // repeated selections would count the same artifact twice
        this.instruments = List.copyOf(new LinkedHashSet<>(builder.instruments));
        this.bands = List.copyOf(new LinkedHashSet<>(builder.bands));
        this.productTypes = List.copyOf(new LinkedHashSet<>(builder.productTypes));
        this.size = builder.size;
        this.workers = builder.workers;
        this.longitudeColumn = builder.longitudeColumn;
        this.latitudeColumn = builder.latitudeColumn;
        this.idColumn = builder.idColumn;
    }

    public List<Instrument> instruments() {
        return instruments;
    }

    /** Requested band codes; empty means every band of every selected instrument. */
    public List<String> bands() {
        return bands;
    }

    public List<ProductType> productTypes() {
        return productTypes;
    }

    public int size() {
        return size;
    }

    public int workers() {
        return workers;
    }

    public String longitudeColumn() {
        return longitudeColumn;
    }

    public String latitudeColumn() {
        return latitudeColumn;
    }

    public String idColumn() {
        return idColumn;
    }

    /**
     * Resolve the requested band codes against the selected instruments.
     *
     * @throws IllegalArgumentException if a band belongs to none of the instruments
     */
    public List<Band> resolveBands() {
        if (bands.isEmpty()) {
            List<Band> all = new ArrayList<>();
            for (Instrument instrument : instruments) {
                all.addAll(instrument.bands());
            }
            return all;
        }
        Set<Band> resolved = new LinkedHashSet<>();
        for (String code : bands) {
            Band match = null;
            for (Instrument instrument : instruments) {
                match = instrument.band(code).orElse(null);
                if (match != null)
                    break;
            }
            if (match == null) {
                throw new IllegalArgumentException(
                        "Band " + code + " is not observed by any of " + instruments);
            }
            resolved.add(match);
        }
        return List.copyOf(resolved);
    }

    public Builder toBuilder() {
        return new Builder()
                .instruments(instruments)
                .bands(bands)
                .productTypes(productTypes)
                .size(size)
                .workers(workers)
                .longitudeColumn(longitudeColumn)
                .latitudeColumn(latitudeColumn)
                .idColumn(idColumn);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Instrument> instruments = new ArrayList<>();
        private final List<String> bands = new ArrayList<>();
        private final List<ProductType> productTypes = new ArrayList<>();
        private int size = 128;
        private int workers = DEFAULT_WORKERS;
        private String longitudeColumn;
        private String latitudeColumn;
        private String idColumn;

        public Builder instruments(List<Instrument> instruments) {
            this.instruments.clear();
            this.instruments.addAll(Objects.requireNonNull(instruments));
            return this;
        }

        public Builder instrument(Instrument instrument) {
            this.instruments.add(Objects.requireNonNull(instrument));
            return this;
        }

        public Builder bands(List<String> bands) {
            this.bands.clear();
            this.bands.addAll(Objects.requireNonNull(bands));
            return this;
        }

        public Builder band(String band) {
            this.bands.add(Objects.requireNonNull(band));
            return this;
        }

        public Builder productTypes(List<ProductType> productTypes) {
            this.productTypes.clear();
            this.productTypes.addAll(Objects.requireNonNull(productTypes));
            return this;
        }

        public Builder productType(ProductType productType) {
            this.productTypes.add(Objects.requireNonNull(productType));
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder longitudeColumn(String longitudeColumn) {
            this.longitudeColumn = longitudeColumn;
            return this;
        }

        public Builder latitudeColumn(String latitudeColumn) {
            this.latitudeColumn = latitudeColumn;
            return this;
        }

        public Builder idColumn(String idColumn) {
            this.idColumn = idColumn;
            return this;
        }

        public CutoutRequest build() {
            return new CutoutRequest(this);
        }
    }

    @Override
    public String toString() {
        return "CutoutRequest{instruments=" + instruments +
                ", bands=" + bands +
                ", productTypes=" + productTypes +
                ", size=" + size +
                ", workers=" + workers + '}';
    }
}
