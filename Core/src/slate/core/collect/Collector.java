package slate.core.collect;

import slate.core.exception.CollectionException;
import slate.core.exception.FixtureGraphException;
import slate.core.fixture.FixtureGraph;

import java.util.List;

/**
 * Discovers the tests of a session.
 *
 * A collector returns the tests in the order they are to be run and may register the fixture definitions it discovers
 * along the way. Any failure is a collection-phase failure and ends the session before a single test runs.
 */
@FunctionalInterface
public interface Collector {

    /**
     * Collects the tests of the session.
     *
     * @param fixtures The graph to register discovered fixtures into. It is validated after collection.
     * @return the collected tests, in run order.
     * @throws CollectionException If discovery fails.
     * @throws FixtureGraphException If a discovered fixture cannot be registered.
     */
    public List<TestCase> collect(FixtureGraph fixtures) throws CollectionException, FixtureGraphException;
}
