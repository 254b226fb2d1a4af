package skycutout.pipeline.producer;

import skycutout.pipeline.model.ArtifactRequest;

/**
 * The image-cropping engine: reads the archive around a position and returns the
 * encoded cutout. Potentially slow and fallible.
 *
 * <p>Implementations must be safe to call from several worker threads at once and must
 * return identical bytes for identical requests.
 */
@FunctionalInterface
public interface ArtifactProducer {

    /**
     * @param request target key, position, instrument, band, product type and size
     * @return encoded artifact content, never empty
     * @throws ArtifactProductionException if the artifact cannot be produced
     */
    byte[] produce(ArtifactRequest request) throws ArtifactProductionException;
}
