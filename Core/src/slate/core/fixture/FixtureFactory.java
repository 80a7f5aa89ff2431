package slate.core.fixture;

/**
 * Produces the value of a fixture.
 */
@FunctionalInterface
public interface FixtureFactory {

    /**
     * Creates the fixture value. Teardown work is registered through {@link FixtureContext#addTeardown(TeardownAction)}.
     *
     * @param context The construction context, holding the values of the fixture's dependencies.
     * @return the fixture value, which may be null.
     * @throws Exception If the fixture cannot be constructed.
     */
    public Object create(FixtureContext context) throws Exception;
}
