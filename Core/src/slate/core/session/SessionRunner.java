package slate.core.session;

import slate.core.collect.Collector;
import slate.core.collect.TestCase;
import slate.core.config.SessionConfig;
import slate.core.exception.CollectionException;
import slate.core.exception.FixtureGraphException;
import slate.core.exception.UnknownFixtureException;
import slate.core.fixture.FixtureGraph;
import slate.core.fixture.FixtureStore;
import slate.core.fixture.ScopeKey;
import slate.core.hook.HookContext;
import slate.core.hook.HookDispatcher;
import slate.core.hook.HookPoint;
import slate.core.result.ResultListener;
import slate.core.result.SessionSummary;
import slate.core.util.CloseableBlockingQueue;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;
import slate.core.util.ThreadLocalPrintStream;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;

/**
 * Drives one test session from collection to close.
 *
 * IDLE -> COLLECTING: {@code session_start} fires, the collector runs and the fixture graph and test requirements are
 * validated. A collection or graph error closes the session right away: {@code session_end} fires and the error is
 * rethrown before any test runs.
 *
 * COLLECTING -> RUNNING: the tests run in collection order, either on the calling thread or, with more than one worker,
 * partitioned by module across worker threads.
 *
 * RUNNING -> FINALIZING: after the last test, an abort or a crash. Tests that never started are recorded as interrupted,
 * {@code before_session_cleanup} fires, every open scope activation is closed narrowest first and {@code session_end}
 * fires last with the summary.
 *
 * A runner runs a single session. {@link #abort(String)} may be called from any thread.
 */
public final class SessionRunner {
    private static final Logger LOGGER = Logger.forClass(SessionRunner.class);
    static final String NOT_STARTED = "session ended before the test started";
    static final String RUNNER_INTERRUPTED = "session runner interrupted";
    private final SessionConfig config;
    private final Collector collector;
    private final FixtureGraph graph;
    private final HookDispatcher dispatcher;
    private final AbortMonitor abortMonitor = new AbortMonitor();
    private final SessionState state;

    private SessionRunner(SessionConfig config, Collector collector, FixtureGraph graph, HookDispatcher dispatcher, List<ResultListener> listeners, String sessionId) {
        ObjectChecker.assertNonNull(config, collector, graph, dispatcher, listeners, sessionId);
        this.config = config;
        this.collector = collector;
        this.graph = graph;
        this.dispatcher = dispatcher;
        this.state = new SessionState(sessionId, this.abortMonitor, config.stopOnFailure, listeners);
    }

    /**
     * Runs the session to completion.
     *
     * @return the summary of the session.
     * @throws CollectionException If the tests could not be collected, including when the collector itself crashed.
     * @throws FixtureGraphException If the fixture graph or a test's fixture requirements are invalid.
     * @throws IllegalStateException If a worker crashed unexpectedly. All pending teardowns have still run.
     */
    public SessionSummary run() throws CollectionException, FixtureGraphException {
        long startTime = System.nanoTime();

        this.state.transitionTo(SessionPhase.COLLECTING);
        fire(HookContext.forSession(HookPoint.SESSION_START, this.state.sessionId));

        List<TestCase> tests;
        try {
            tests = collectTests();
            this.graph.validate();
            validateTests(tests);
        } catch (Throwable t) {
            LOGGER.warn("Session " + this.state.sessionId + " could not start.", t);
            this.state.transitionTo(SessionPhase.CLOSED);
            fire(HookContext.forSessionEnd(this.state.sessionId, this.state.summarize(System.nanoTime() - startTime)));
            throw t;
        }
        LOGGER.log("Collected " + tests.size() + " tests.");

        FixtureStore store = FixtureStore.forGraph(this.graph);
        TestCaseExecutor executor = new TestCaseExecutor(this.state, store, this.dispatcher, this.config.captureOutput);
        boolean installedStreams = this.config.captureOutput && ThreadLocalPrintStream.install();
        this.state.startRunning(tests, store);

        SessionSummary summary;
        boolean interrupted = false;
        try {
            if (this.config.isParallel()) {
                interrupted = runInParallel(tests, executor, store);
            } else {
                TestWorker.inline(executor, this.state, store).runTests(tests);
            }
        } catch (Throwable t) {
            this.abortMonitor.panic(t);
        } finally {
            summary = finalizeSession(executor, store, startTime);
            if (installedStreams) {
                ThreadLocalPrintStream.uninstall();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Throwable panic = this.abortMonitor.getCauseOfPanic();
        if (panic != null) {
            throw new IllegalStateException("Session " + this.state.sessionId + " crashed.", panic);
        }
        return summary;
    }

    /**
     * Requests that the session stop. The tests not yet started are recorded as interrupted; the session still finalizes
     * and runs all pending teardowns.
     *
     * @param reason Why the session is aborted.
     */
    public void abort(String reason) {
        LOGGER.log("Abort requested: " + reason);
        this.abortMonitor.requestAbort(reason);
    }

    public SessionPhase getPhase() {
        return this.state.getPhase();
    }

    public SessionState getState() {
        return this.state;
    }

    /**
     * Runs the collector. Anything it throws besides the checked collection and graph errors is a collection failure.
     */
    private List<TestCase> collectTests() throws CollectionException, FixtureGraphException {
        try {
            return this.collector.collect(this.graph);
        } catch (CollectionException | FixtureGraphException e) {
            throw e;
        } catch (Throwable t) {
            throw new CollectionException("Collector failed: " + t, t);
        }
    }

    private void validateTests(List<TestCase> tests) throws CollectionException, UnknownFixtureException {
        Set<String> ids = new HashSet<>();
        for (TestCase test : tests) {
            if (!ids.add(test.id)) {
                throw new CollectionException("Duplicate test id: " + test.id);
            }
            for (String fixtureName : test.requiredFixtures) {
                if (!this.graph.contains(fixtureName)) {
                    throw new UnknownFixtureException(fixtureName, test.id);
                }
            }
        }
    }

    /**
     * Runs the tests on worker threads and waits for all of them to exit. If the calling thread is interrupted meanwhile,
     * the session is aborted and the workers are still awaited, since they may be using fixtures that only finalization
     * may close.
     *
     * @return whether the calling thread was interrupted.
     */
    private boolean runInParallel(List<TestCase> tests, TestCaseExecutor executor, FixtureStore store) throws InterruptedException {
        List<List<TestCase>> batches = partitionByModule(tests);
        CloseableBlockingQueue<List<TestCase>> queue = CloseableBlockingQueue.withCapacity(Math.max(1, batches.size()));
        for (List<TestCase> batch : batches) {
            if (!queue.add(batch, 1, TimeUnit.SECONDS)) {
                throw new IllegalStateException("unable to submit batch: queue is closed or full.");
            }
        }
        queue.close();

        int numWorkers = Math.min(this.config.numWorkers, Math.max(1, batches.size()));
        CyclicBarrier barrier = new CyclicBarrier(numWorkers);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < numWorkers; i++) {
            Thread thread = new Thread(TestWorker.withQueue(barrier, queue, executor, this.state, store), "TestWorker-" + i);
            threads.add(thread);
            thread.start();
        }
        LOGGER.log("Started " + numWorkers + " workers over " + batches.size() + " module batches.");

        boolean interrupted = false;
        for (Thread thread : threads) {
            while (thread.isAlive()) {
                try {
                    thread.join();
                } catch (InterruptedException e) {
                    if (!interrupted) {
                        LOGGER.warn("Interrupted while awaiting workers; aborting the session.");
                    }
                    interrupted = true;
                    this.abortMonitor.requestAbort(RUNNER_INTERRUPTED);
                }
            }
        }

        // Batches left behind by crashed workers never started.
        for (List<TestCase> batch : queue.drain()) {
            for (TestCase test : batch) {
                executor.interrupt(test, interruptReason());
            }
        }
        return interrupted;
    }

    private static List<List<TestCase>> partitionByModule(List<TestCase> tests) {
        Map<String, List<TestCase>> byModule = new LinkedHashMap<>();
        for (TestCase test : tests) {
            byModule.computeIfAbsent(test.moduleKey, k -> new ArrayList<>()).add(test);
        }
        return new ArrayList<>(byModule.values());
    }

    private SessionSummary finalizeSession(TestCaseExecutor executor, FixtureStore store, long startTime) {
        this.state.transitionTo(SessionPhase.FINALIZING);

        for (TestCase test : this.state.getTests()) {
            if (this.state.getTestPhase(test.id) == TestPhase.PENDING) {
                executor.interrupt(test, interruptReason());
            }
        }

        fire(HookContext.forSession(HookPoint.BEFORE_SESSION_CLEANUP, this.state.sessionId));
        for (ScopeKey scopeKey : store.getOpenScopeKeys()) {
            executor.recordTeardownFailures(store.closeScope(scopeKey.scope, scopeKey.key), null);
        }

        fire(HookContext.forSessionEnd(this.state.sessionId, this.state.summarize(System.nanoTime() - startTime)));
        this.state.transitionTo(SessionPhase.CLOSED);

        SessionSummary summary = this.state.summarize(System.nanoTime() - startTime);
        this.state.notifySessionFinished(summary);
        LOGGER.log("Session " + this.state.sessionId + " closed: " + summary);
        return summary;
    }

    private String interruptReason() {
        String reason = this.abortMonitor.getAbortReason();
        return (reason == null) ? NOT_STARTED : reason;
    }

    private void fire(HookContext context) {
        this.state.recordHookFailures(this.dispatcher.invoke(context), null);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { session: " + this.state.sessionId + ", phase: " + this.state.getPhase() + " }";
    }

    public static final class Builder {
        private SessionConfig config = SessionConfig.defaults();
        private Collector collector;
        private FixtureGraph graph = new FixtureGraph();
        private HookDispatcher dispatcher = new HookDispatcher();
        private final List<ResultListener> listeners = new ArrayList<>();
        private String sessionId = UUID.randomUUID().toString();

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder config(SessionConfig config) {
            this.config = config;
            return this;
        }

        public Builder collector(Collector collector) {
            this.collector = collector;
            return this;
        }

        /**
         * The graph the collector registers fixtures into. Defaults to a fresh, empty graph.
         */
        public Builder fixtures(FixtureGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder hooks(HookDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder addListener(ResultListener listener) {
            ObjectChecker.assertNonNull(listener);
            this.listeners.add(listener);
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public SessionRunner build() {
            return new SessionRunner(this.config, this.collector, this.graph, this.dispatcher, this.listeners, this.sessionId);
        }
    }
}
