package slate.core.exception;

/**
 * Thrown when parsing configuration and finding that it is not structured as expected.
 */
public final class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }
}
