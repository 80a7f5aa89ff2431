package slate.core.hook;

import slate.core.collect.TestCase;
import slate.core.result.Result;
import slate.core.result.SessionSummary;
import slate.core.util.ObjectChecker;

/**
 * What a handler sees when a hook point fires. A fresh context is created for every invocation of a point.
 *
 * {@link #test} is set for the test points, {@link #result} for {@link HookPoint#AFTER_TEST} and
 * {@link HookPoint#ON_ERROR}, and {@link #summary} for {@link HookPoint#SESSION_END}. An {@link HookPoint#ON_ERROR}
 * for a teardown error record carries no test when the scope was not closed on behalf of a single test.
 */
public final class HookContext {
    public final HookPoint point;
    public final String sessionId;
    public final TestCase test;
    public final Result result;
    public final SessionSummary summary;
    private volatile String skipReason = null;

    private HookContext(HookPoint point, String sessionId, TestCase test, Result result, SessionSummary summary) {
        ObjectChecker.assertNonNull(point, sessionId);
        this.point = point;
        this.sessionId = sessionId;
        this.test = test;
        this.result = result;
        this.summary = summary;
    }

    public static HookContext forSession(HookPoint point, String sessionId) {
        return new HookContext(point, sessionId, null, null, null);
    }

    public static HookContext forTest(HookPoint point, String sessionId, TestCase test) {
        ObjectChecker.assertNonNull(test);
        return new HookContext(point, sessionId, test, null, null);
    }

    public static HookContext forResult(HookPoint point, String sessionId, TestCase test, Result result) {
        ObjectChecker.assertNonNull(test, result);
        return new HookContext(point, sessionId, test, result, null);
    }

    public static HookContext forErrorRecord(String sessionId, TestCase test, Result record) {
        ObjectChecker.assertNonNull(record);
        return new HookContext(HookPoint.ON_ERROR, sessionId, test, record, null);
    }

    public static HookContext forSessionEnd(String sessionId, SessionSummary summary) {
        ObjectChecker.assertNonNull(summary);
        return new HookContext(HookPoint.SESSION_END, sessionId, null, null, summary);
    }

    /**
     * Requests that the test about to run be skipped. Only honored at {@link HookPoint#BEFORE_TEST}.
     *
     * @param reason The skip reason.
     */
    public void requestSkip(String reason) {
        ObjectChecker.assertNonNull(reason);
        if (this.point != HookPoint.BEFORE_TEST) {
            throw new IllegalStateException("Skip can only be requested at " + HookPoint.BEFORE_TEST + " but point is " + this.point);
        }
        if (this.skipReason == null) {
            this.skipReason = reason;
        }
    }

    /**
     * Returns the first skip reason requested by a handler, or null if no skip was requested.
     */
    public String getSkipReason() {
        return this.skipReason;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { point: " + this.point + ", session: " + this.sessionId
                + ((this.test != null) ? ", test: " + this.test.id : "") + " }";
    }
}
