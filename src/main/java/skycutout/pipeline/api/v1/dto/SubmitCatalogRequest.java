package skycutout.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import skycutout.pipeline.config.CutoutConfig;
import skycutout.pipeline.model.CutoutRequest;
import skycutout.pipeline.model.Instrument;
import skycutout.pipeline.model.ProductType;

import java.util.List;

/**
 * Request DTO for submitting a catalog.
 * Names are plain strings here; {@link #toCutoutRequest(CutoutConfig)} parses them.
 */
public record SubmitCatalogRequest(
        @JsonProperty("catalog") String catalog,
        @JsonProperty("instruments") List<String> instruments,
        @JsonProperty("bands") List<String> bands,
        @JsonProperty("productTypes") List<String> productTypes,
        @JsonProperty("size") Integer size,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("raColumn") String raColumn,
        @JsonProperty("decColumn") String decColumn,
        @JsonProperty("idColumn") String idColumn) {

    /** Validate the request */
    public void validate() {
        if (catalog == null || catalog.isBlank()) {
            throw new IllegalArgumentException("catalog is required");
        }
        if (instruments == null || instruments.isEmpty()) {
            throw new IllegalArgumentException("instruments must not be empty");
        }
        if (productTypes == null || productTypes.isEmpty()) {
            throw new IllegalArgumentException("productTypes must not be empty");
        }
        if (size != null && size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (workers != null && (workers < 1 || workers > CutoutRequest.MAX_WORKERS)) {
            throw new IllegalArgumentException("workers must be between 1 and " + CutoutRequest.MAX_WORKERS);
        }
        instruments.forEach(Instrument::parse);
        productTypes.forEach(ProductType::parse);
    }

    /**
     * Convert to a domain request, filling size and workers from the config defaults.
     *
     * @throws IllegalArgumentException if the request is invalid
     */
    public CutoutRequest toCutoutRequest(CutoutConfig config) {
        validate();
        return CutoutRequest.builder()
                .instruments(instruments.stream().map(Instrument::parse).distinct().toList())
                .bands(bands != null ? bands : List.of())
                .productTypes(productTypes.stream().map(ProductType::parse).distinct().toList())
                .size(size != null ? size : config.defaultSize())
                .workers(workers != null ? workers : config.defaultWorkers())
                .longitudeColumn(raColumn)
                .latitudeColumn(decColumn)
                .idColumn(idColumn)
                .build();
    }
}
