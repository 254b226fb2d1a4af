package skycutout.pipeline.packaging;

/**
 * The output bundle could not be written. Fatal to the task.
 */
public class PackagingException extends Exception {

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
