package slate.core.exception;

/**
 * Thrown when a fixture or a test requires a fixture name that was never registered.
 */
public final class UnknownFixtureException extends FixtureGraphException {
    public final String fixtureName;
    public final String requiredBy;

    public UnknownFixtureException(String fixtureName, String requiredBy) {
        super("Unknown fixture '" + fixtureName + "' required by " + requiredBy);
        this.fixtureName = fixtureName;
        this.requiredBy = requiredBy;
    }
}
