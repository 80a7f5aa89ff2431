package slate.core.session;

import slate.core.collect.TestCase;
import slate.core.exception.FixtureTeardownException;
import slate.core.exception.HookException;
import slate.core.fixture.FixtureStore;
import slate.core.result.Result;
import slate.core.result.ResultListener;
import slate.core.result.SessionSummary;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The aggregate state of one session: its phase, the collected tests, the fixture store holding the live scope
 * instances, the cumulative results and the abort monitor. Created when a session starts and owned by its
 * {@link SessionRunner}; workers only ever record into it.
 *
 * Recording is serialized: results are appended and handed to the listeners under one lock, so listeners see results in
 * recording order even when several workers complete tests concurrently.
 */
public final class SessionState {
    private static final Logger LOGGER = Logger.forClass(SessionState.class);
    public final String sessionId;
    private final Object monitor = new Object();
    private final AbortMonitor abortMonitor;
    private final boolean stopOnFailure;
    private final List<ResultListener> listeners;
    private final List<Result> results = new ArrayList<>();
    private final Map<String, TestPhase> testPhases = new ConcurrentHashMap<>();
    private volatile SessionPhase phase = SessionPhase.IDLE;
    private volatile boolean isStopRequested = false;
    private List<TestCase> tests = Collections.emptyList();
    private FixtureStore store = null;

    SessionState(String sessionId, AbortMonitor abortMonitor, boolean stopOnFailure, List<ResultListener> listeners) {
        ObjectChecker.assertNonNull(sessionId, abortMonitor, listeners);
        this.sessionId = sessionId;
        this.abortMonitor = abortMonitor;
        this.stopOnFailure = stopOnFailure;
        this.listeners = new ArrayList<>(listeners);
    }

    public SessionPhase getPhase() {
        return this.phase;
    }

    void transitionTo(SessionPhase next) {
        synchronized (this.monitor) {
            if (!this.phase.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal session transition: " + this.phase + " -> " + next);
            }
            LOGGER.log("Session " + this.sessionId + ": " + this.phase + " -> " + next);
            this.phase = next;
        }
    }

    /**
     * Moves the session into {@link SessionPhase#RUNNING} with the collected tests and the store that will hold their
     * fixtures.
     */
    void startRunning(List<TestCase> tests, FixtureStore store) {
        ObjectChecker.assertNonNull(tests, store);
        synchronized (this.monitor) {
            this.tests = Collections.unmodifiableList(new ArrayList<>(tests));
            this.store = store;
            for (TestCase test : tests) {
                this.testPhases.put(test.id, TestPhase.PENDING);
            }
            transitionTo(SessionPhase.RUNNING);
        }
    }

    public List<TestCase> getTests() {
        synchronized (this.monitor) {
            return this.tests;
        }
    }

    /**
     * Returns the store holding the live scope instances, or null before the session runs.
     */
    public FixtureStore getStore() {
        synchronized (this.monitor) {
            return this.store;
        }
    }

    void setTestPhase(String testId, TestPhase testPhase) {
        this.testPhases.put(testId, testPhase);
    }

    /**
     * Returns the phase the given test is in, or null if it is not part of this session.
     */
    public TestPhase getTestPhase(String testId) {
        return this.testPhases.get(testId);
    }

    AbortMonitor getAbortMonitor() {
        return this.abortMonitor;
    }

    public boolean isAbortRequested() {
        return this.abortMonitor.isAbortRequested();
    }

    /**
     * Returns true iff a failed test has stopped the session under stop-on-failure.
     */
    public boolean isStopRequested() {
        return this.isStopRequested;
    }

    /**
     * Appends the result and hands it to every listener.
     */
    void record(Result result) {
        ObjectChecker.assertNonNull(result);
        synchronized (this.monitor) {
            this.results.add(result);
            if (this.stopOnFailure && result.isTestResult() && result.outcome.isFailure()) {
                this.isStopRequested = true;
            }
            for (ResultListener listener : this.listeners) {
                try {
                    listener.onResult(result);
                } catch (RuntimeException e) {
                    LOGGER.warn("Result listener " + listener + " failed on " + result, e);
                }
            }
        }
    }

    List<Result> recordTeardownFailures(List<FixtureTeardownException> failures, String testId) {
        List<Result> records = new ArrayList<>();
        for (FixtureTeardownException failure : failures) {
            Result error = Result.teardownError(failure, testId);
            record(error);
            records.add(error);
        }
        return records;
    }

    void recordHookFailures(List<HookException> failures, String testId) {
        for (HookException failure : failures) {
            record(Result.hookError(failure, testId));
        }
    }

    /**
     * Returns a snapshot of all results recorded so far, in recording order.
     */
    public List<Result> getResults() {
        synchronized (this.monitor) {
            return new ArrayList<>(this.results);
        }
    }

    SessionSummary summarize(long durationNanos) {
        synchronized (this.monitor) {
            return SessionSummary.summarize(this.results, durationNanos, this.abortMonitor.isAbortRequested());
        }
    }

    void notifySessionFinished(SessionSummary summary) {
        synchronized (this.monitor) {
            for (ResultListener listener : this.listeners) {
                try {
                    listener.onSessionFinished(summary);
                } catch (RuntimeException e) {
                    LOGGER.warn("Result listener " + listener + " failed on session summary.", e);
                }
            }
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { session: " + this.sessionId + ", phase: " + this.phase + ", results: " + getResults().size() + " }";
    }
}
