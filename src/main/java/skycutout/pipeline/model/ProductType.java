package skycutout.pipeline.model;

import java.util.Locale;

/**
 * Kind of derived image artifact requested for a target.
 */
public enum ProductType {
    /** Background-subtracted mosaic */
    BGSUB("BGSUB"),
    /** Background model */
    BGMOD("BGMOD"),
    /** Flag map */
    FLAG("FLAG"),
    /** RMS (weight) map */
    RMS("RMS"),
    /** PSF catalog stamp */
    CATALOG_PSF("CATALOG-PSF");

    private final String code;

    ProductType(String code) {
        this.code = code;
    }

    /** Archive name, e.g. {@code CATALOG-PSF}. */
    public String code() {
        return code;
    }

    /** Name used in file and directory names, e.g. {@code CATALOG_PSF}. */
    public String fileToken() {
        return code.replace('-', '_');
    }

    /** Parse either the archive name or the file token, case-insensitive. */
    public static ProductType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("product type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ProductType type : values()) {
            if (type.code.equals(normalized) || type.fileToken().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown product type: " + value);
    }
}
