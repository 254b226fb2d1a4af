package skycutout.pipeline.catalog;

/**
 * A catalog submission cannot be accepted. Fatal to the whole submission.
 */
public class CatalogValidationException extends Exception {

    public CatalogValidationException(String message) {
        super(message);
    }

    public CatalogValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
