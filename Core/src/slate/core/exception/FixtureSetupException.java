package slate.core.exception;

/**
 * Thrown when a fixture needed by a test cannot be constructed. Fails the requesting test only.
 */
public final class FixtureSetupException extends Exception {
    public final String fixtureName;

    public FixtureSetupException(String fixtureName, Throwable cause) {
        super("Setup of fixture '" + fixtureName + "' failed: " + describe(cause), cause);
        this.fixtureName = fixtureName;
    }

    static String describe(Throwable cause) {
        return (cause.getMessage() == null) ? cause.getClass().getName() : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
