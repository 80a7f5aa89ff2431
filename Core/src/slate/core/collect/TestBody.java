package slate.core.collect;

import slate.core.fixture.FixtureValues;

/**
 * The executable body of a test.
 *
 * A body passes by returning normally. An {@link AssertionError} marks the test failed, a
 * {@link slate.core.exception.SkipTestException} marks it skipped, and anything else marks it as an error.
 */
@FunctionalInterface
public interface TestBody {

    public void run(FixtureValues fixtures) throws Exception;
}
