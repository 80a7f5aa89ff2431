package slate.core.exception;

/**
 * Thrown from a test body or a fixture factory to skip the running test.
 */
public final class SkipTestException extends RuntimeException {

    public SkipTestException(String reason) {
        super(reason);
    }
}
