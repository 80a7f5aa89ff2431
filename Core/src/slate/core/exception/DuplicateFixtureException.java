package slate.core.exception;

/**
 * Thrown when a fixture is registered under a name that is already taken.
 */
public final class DuplicateFixtureException extends FixtureGraphException {
    public final String fixtureName;

    public DuplicateFixtureException(String fixtureName) {
        super("Fixture already registered: " + fixtureName);
        this.fixtureName = fixtureName;
    }
}
