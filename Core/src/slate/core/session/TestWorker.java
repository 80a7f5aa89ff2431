package slate.core.session;

import slate.core.collect.TestCase;
import slate.core.fixture.FixtureDefinition;
import slate.core.fixture.FixtureGraph;
import slate.core.fixture.FixtureStore;
import slate.core.fixture.Scope;
import slate.core.fixture.ScopePath;
import slate.core.util.CloseableBlockingQueue;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;

/**
 * Runs batches of tests one at a time, in order, and closes the scope activations they leave behind.
 *
 * A module or custom scope activation is closed as soon as the next test of the batch runs in a different activation of
 * it. A change in a wider scope closes every narrower one as well, narrowest first.
 *
 * Before each test the worker checks whether the session was aborted or stopped on a failure; if so the test is not
 * started and is recorded as interrupted or skipped respectively.
 */
final class TestWorker implements Runnable {
    static final String STOPPED_ON_FAILURE = "stopped on failure";
    private static final Logger LOGGER = Logger.forClass(TestWorker.class);
    private final CyclicBarrier barrier;
    private final CloseableBlockingQueue<List<TestCase>> batches;
    private final TestCaseExecutor executor;
    private final SessionState state;
    private final FixtureStore store;
    private final List<Scope> boundaryScopes;
    private final boolean closeScopesAfterBatch;

    private TestWorker(CyclicBarrier barrier, CloseableBlockingQueue<List<TestCase>> batches, TestCaseExecutor executor, SessionState state, FixtureStore store, boolean closeScopesAfterBatch) {
        ObjectChecker.assertNonNull(executor, state, store);
        this.barrier = barrier;
        this.batches = batches;
        this.executor = executor;
        this.state = state;
        this.store = store;
        this.boundaryScopes = findBoundaryScopes(store.getGraph());
        this.closeScopesAfterBatch = closeScopesAfterBatch;
    }

    /**
     * Creates a worker that waits on the barrier and then runs every batch it can take from the queue until the queue
     * is closed and empty. The module and custom scopes of each batch are closed when the batch is done, so batches
     * must not share any such activation.
     *
     * @param barrier The barrier to wait on before running.
     * @param batches The queue of batches shared by all workers.
     * @param executor The executor running each test.
     * @param state The session state.
     * @param store The fixture store.
     * @return the new worker.
     */
    static TestWorker withQueue(CyclicBarrier barrier, CloseableBlockingQueue<List<TestCase>> batches, TestCaseExecutor executor, SessionState state, FixtureStore store) {
        ObjectChecker.assertNonNull(barrier, batches);
        return new TestWorker(barrier, batches, executor, state, store, true);
    }

    /**
     * Creates a worker that only runs tests on the calling thread. The scopes still open after its last test are left
     * to the session's finalization.
     */
    static TestWorker inline(TestCaseExecutor executor, SessionState state, FixtureStore store) {
        return new TestWorker(null, null, executor, state, store, false);
    }

    @Override
    public void run() {
        try {
            LOGGER.log("Waiting for other threads to hit barrier.");
            this.barrier.await();
            LOGGER.log(Thread.currentThread().getName() + " thread started.");

            while (!this.batches.isClosedAndEmpty()) {
                List<TestCase> batch = this.batches.poll(100, TimeUnit.MILLISECONDS);
                if (batch != null) {
                    LOGGER.log("Running batch of " + batch.size() + " tests.");
                    runTests(batch);
                }
            }
        } catch (Throwable t) {
            this.state.getAbortMonitor().panic(t);
        } finally {
            LOGGER.log("Exiting.");
        }
    }

    /**
     * Runs the given tests in order on the calling thread.
     *
     * @param tests The tests to run.
     */
    void runTests(List<TestCase> tests) {
        ObjectChecker.assertNonNull(tests);

        ScopePath previous = null;
        for (TestCase test : tests) {
            if (this.state.isAbortRequested()) {
                this.executor.interrupt(test, this.state.getAbortMonitor().getAbortReason());
                continue;
            }
            if (this.state.isStopRequested()) {
                this.executor.skipNotStarted(test, STOPPED_ON_FAILURE);
                continue;
            }

            ScopePath current = test.getScopePath();
            if (previous != null) {
                closeLeftScopes(previous, current);
            }
            this.executor.execute(test);
            previous = current;
        }

        if (this.closeScopesAfterBatch && (previous != null)) {
            closeLeftScopes(previous, null);
        }
    }

    /**
     * Closes the activations of {@code previous} that {@code next} does not run in. A null {@code next} closes them all.
     */
    private void closeLeftScopes(ScopePath previous, ScopePath next) {
        int widestChanged = -1;
        for (int i = 0; i < this.boundaryScopes.size(); i++) {
            Scope scope = this.boundaryScopes.get(i);
            if ((next == null) || !previous.keyFor(scope).equals(next.keyFor(scope))) {
                widestChanged = i;
            }
        }

        for (int i = 0; i <= widestChanged; i++) {
            Scope scope = this.boundaryScopes.get(i);
            this.executor.recordTeardownFailures(this.store.closeScope(scope, previous.keyFor(scope)), null);
        }
    }

    /**
     * Returns the module scope and every custom scope declared in the graph, narrowest first.
     */
    private static List<Scope> findBoundaryScopes(FixtureGraph graph) {
        TreeSet<Scope> scopes = new TreeSet<>();
        scopes.add(Scope.MODULE);
        for (FixtureDefinition definition : graph.getDefinitions()) {
            if (definition.scope.isCustom()) {
                scopes.add(definition.scope);
            }
        }
        return new ArrayList<>(scopes);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { boundary scopes: " + this.boundaryScopes + " }";
    }
}
