package slate.core.session;

import slate.core.collect.TestCase;
import slate.core.exception.FixtureSetupException;
import slate.core.exception.FixtureTeardownException;
import slate.core.exception.SkipTestException;
import slate.core.exception.UnknownFixtureException;
import slate.core.fixture.FixtureGraph;
import slate.core.fixture.FixtureStore;
import slate.core.fixture.FixtureValues;
import slate.core.fixture.Scope;
import slate.core.hook.HookContext;
import slate.core.hook.HookDispatcher;
import slate.core.hook.HookPoint;
import slate.core.result.ErrorOrigin;
import slate.core.result.Failure;
import slate.core.result.Outcome;
import slate.core.result.Result;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a single test through its phases and records its result.
 *
 * PENDING: {@code before_test} fires; a skip marker or a handler's skip request ends the test here.
 * SETTING_UP: every required fixture is fetched from the store in resolution order; a setup failure skips execution.
 * EXECUTING: the body runs.
 * TEARING_DOWN: the test-scoped instance is closed.
 * DONE: {@code after_test} fires, the result and any teardown errors are recorded, then {@code on_error} fires for a
 * result that is not a pass.
 *
 * Instances are stateless beyond their collaborators and may be shared by all workers of a session.
 */
final class TestCaseExecutor {
    private static final Logger LOGGER = Logger.forClass(TestCaseExecutor.class);
    private final SessionState state;
    private final FixtureGraph graph;
    private final FixtureStore store;
    private final HookDispatcher dispatcher;
    private final boolean captureOutput;

    TestCaseExecutor(SessionState state, FixtureStore store, HookDispatcher dispatcher, boolean captureOutput) {
        ObjectChecker.assertNonNull(state, store, dispatcher);
        this.state = state;
        this.graph = store.getGraph();
        this.store = store;
        this.dispatcher = dispatcher;
        this.captureOutput = captureOutput;
    }

    /**
     * Runs the test and records its result.
     *
     * @param test The test to run.
     * @return the recorded result.
     */
    Result execute(TestCase test) {
        ObjectChecker.assertNonNull(test);
        LOGGER.log("Starting test " + test.id);

        HookContext beforeTest = HookContext.forTest(HookPoint.BEFORE_TEST, this.state.sessionId, test);
        this.state.recordHookFailures(this.dispatcher.invoke(beforeTest), test.id);
        String skipReason = test.isMarkedSkip() ? test.skipReason : beforeTest.getSkipReason();

        Result.Builder builder = Result.Builder.forTest(test.id);
        List<FixtureTeardownException> teardownFailures = Collections.emptyList();
        OutputCapture capture = this.captureOutput ? OutputCapture.start() : OutputCapture.disabled();
        long startTime = System.nanoTime();
        long endTime;
        String stdout;
        String stderr;

        try {
            if (skipReason != null) {
                builder.skipped(skipReason);
            } else {
                FixtureValues values = setUp(test, builder);
                if (values != null) {
                    runBody(test, values, builder);
                }
                this.state.setTestPhase(test.id, TestPhase.TEARING_DOWN);
                teardownFailures = this.store.closeScope(Scope.TEST, test.getScopePath().keyFor(Scope.TEST));
            }
        } finally {
            endTime = System.nanoTime();
            stdout = capture.stopAndGetStdout();
            stderr = capture.stopAndGetStderr();
        }

        Result result = builder
                .durationNanos(endTime - startTime)
                .capturedOutput(stdout, stderr)
                .build();
        this.state.setTestPhase(test.id, TestPhase.DONE);

        this.state.recordHookFailures(this.dispatcher.invoke(HookContext.forResult(HookPoint.AFTER_TEST, this.state.sessionId, test, result)), test.id);
        this.state.record(result);
        recordTeardownFailures(teardownFailures, test);
        if (result.outcome != Outcome.PASSED) {
            fireOnError(test, result);
        }
        LOGGER.log("Completed test " + test.id + ": " + result.outcome);
        return result;
    }

    /**
     * Records a test that never started because the session was aborted.
     */
    Result interrupt(TestCase test, String reason) {
        return recordNotStarted(test, Result.Builder.forTest(test.id).interrupted(reason).build());
    }

    /**
     * Records a test that never started because the session stopped on a failure.
     */
    Result skipNotStarted(TestCase test, String reason) {
        return recordNotStarted(test, Result.Builder.forTest(test.id).skipped(reason).build());
    }

    private Result recordNotStarted(TestCase test, Result result) {
        this.state.setTestPhase(test.id, TestPhase.DONE);
        this.state.record(result);
        fireOnError(test, result);
        return result;
    }

    /**
     * Records an error record for each failed teardown and fires {@link HookPoint#ON_ERROR} for it.
     *
     * @param failures The failed teardowns.
     * @param test The test whose scope was closed, or null for a scope closed at a boundary or at session end.
     */
    void recordTeardownFailures(List<FixtureTeardownException> failures, TestCase test) {
        String testId = (test == null) ? null : test.id;
        for (Result error : this.state.recordTeardownFailures(failures, testId)) {
            this.state.recordHookFailures(this.dispatcher.invoke(HookContext.forErrorRecord(this.state.sessionId, test, error)), testId);
        }
    }

    private FixtureValues setUp(TestCase test, Result.Builder builder) {
        this.state.setTestPhase(test.id, TestPhase.SETTING_UP);
        try {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String fixtureName : this.graph.resolutionOrder(test.requiredFixtures)) {
                Object value = this.store.get(fixtureName, test.getScopePath());
                if (test.requiredFixtures.contains(fixtureName)) {
                    values.put(fixtureName, value);
                }
            }
            return FixtureValues.of(values);
        } catch (FixtureSetupException e) {
            if (e.getCause() instanceof SkipTestException) {
                builder.skipped(e.getCause().getMessage());
            } else {
                builder.failed(Failure.of(ErrorOrigin.FIXTURE_SETUP, e));
            }
            return null;
        } catch (UnknownFixtureException e) {
            // Test requirements are validated before the session runs.
            throw new IllegalStateException("Test " + test.id + " requires an unknown fixture after validation.", e);
        }
    }

    private void runBody(TestCase test, FixtureValues values, Result.Builder builder) {
        this.state.setTestPhase(test.id, TestPhase.EXECUTING);
        try {
            test.body.run(values);
            builder.passed();
        } catch (SkipTestException e) {
            builder.skipped(e.getMessage());
        } catch (Throwable t) {
            builder.failed(Failure.of(ErrorOrigin.TEST_BODY, t));
        }
    }

    private void fireOnError(TestCase test, Result result) {
        this.state.recordHookFailures(this.dispatcher.invoke(HookContext.forResult(HookPoint.ON_ERROR, this.state.sessionId, test, result)), test.id);
    }
}
