package slate.core.exception;

/**
 * Thrown when a fixture depends on a fixture whose scope is narrower than its own, which would let a cached value
 * outlive one of its dependencies.
 */
public final class ScopeMismatchException extends FixtureGraphException {

    public ScopeMismatchException(String fixtureName, String fixtureScope, String dependencyName, String dependencyScope) {
        super("Fixture '" + fixtureName + "' with scope " + fixtureScope + " cannot depend on '" + dependencyName + "' with narrower scope " + dependencyScope);
    }
}
