package skycutout.pipeline.model;

import java.util.Objects;

/**
 * One (target, band, product type, size) artifact.
 * Identity, and therefore the cache path, is fully determined by the target key, band,
 * product type and size; the sky position only travels along for the producer.
 */
public final class ArtifactRequest {
    private final TargetKey targetKey;
    private final SkyPosition position;
    private final Band band;
    private final ProductType productType;
    private final int size;

    public ArtifactRequest(TargetKey targetKey, SkyPosition position, Band band, ProductType productType, int size) {
        this.targetKey = Objects.requireNonNull(targetKey, "targetKey is required");
        this.position = Objects.requireNonNull(position, "position is required");
        this.band = Objects.requireNonNull(band, "band is required");
        this.productType = Objects.requireNonNull(productType, "productType is required");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        this.size = size;
    }

    public static ArtifactRequest of(Target target, Band band, ProductType productType, int size) {
        return new ArtifactRequest(target.key(), target.position(), band, productType, size);
    }

    public TargetKey targetKey() {
        return targetKey;
    }

    public SkyPosition position() {
        return position;
    }

    public Instrument instrument() {
        return band.instrument();
    }

    public Band band() {
        return band;
    }

    public ProductType productType() {
        return productType;
    }

    public int size() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ArtifactRequest that))
            return false;
        return size == that.size
                && targetKey.equals(that.targetKey)
                && band.equals(that.band)
                && productType == that.productType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetKey, band, productType, size);
    }

    @Override
    public String toString() {
        return "ArtifactRequest{" + targetKey + ", " + band + ", " + productType.code() + ", size=" + size + "}";
    }
}
