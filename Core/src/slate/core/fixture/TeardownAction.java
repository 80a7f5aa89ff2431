package slate.core.fixture;

/**
 * Releases whatever a fixture factory acquired.
 */
@FunctionalInterface
public interface TeardownAction {

    public void teardown() throws Exception;
}
