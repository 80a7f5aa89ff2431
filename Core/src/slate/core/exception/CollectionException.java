package slate.core.exception;

/**
 * Thrown when test discovery fails. A collection failure is fatal to the whole session: no test is run.
 */
public final class CollectionException extends Exception {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
