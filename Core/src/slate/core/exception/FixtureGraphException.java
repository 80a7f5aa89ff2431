package slate.core.exception;

/**
 * Thrown when the declared fixtures do not form a valid graph. An invalid graph is detected before any test runs and
 * is fatal to the session.
 */
public class FixtureGraphException extends Exception {

    public FixtureGraphException(String message) {
        super(message);
    }
}
