package slate.core.result;

import slate.core.exception.FixtureTeardownException;
import slate.core.exception.HookException;
import slate.core.util.ObjectChecker;

/**
 * A single recorded result.
 *
 * A result is either the outcome of a test ({@link Kind#TEST}) or a distinct error record for a failed fixture teardown
 * ({@link Kind#TEARDOWN}) or a failed hook handler ({@link Kind#HOOK}). Error records carry the id of the test during
 * which they happened, or null when they happened outside of any test.
 *
 * {@link #failure} is null iff the outcome is {@link Outcome#PASSED}, {@link Outcome#SKIPPED} or
 * {@link Outcome#INTERRUPTED}; skipped and interrupted results carry a {@link #reason} instead.
 */
public final class Result {
    public enum Kind { TEST, TEARDOWN, HOOK }

    public final Kind kind;
    public final String testId;
    public final String subject;
    public final Outcome outcome;
    public final Failure failure;
    public final String reason;
    public final long durationNanos;
    public final String capturedStdout;
    public final String capturedStderr;

    private Result(Kind kind, String testId, String subject, Outcome outcome, Failure failure, String reason, long durationNanos, String capturedStdout, String capturedStderr) {
        this.kind = kind;
        this.testId = testId;
        this.subject = subject;
        this.outcome = outcome;
        this.failure = failure;
        this.reason = reason;
        this.durationNanos = durationNanos;
        this.capturedStdout = capturedStdout;
        this.capturedStderr = capturedStderr;
    }

    /**
     * Returns the error record for a failed fixture teardown.
     *
     * @param error The teardown failure.
     * @param testId The test during which the teardown ran, or null.
     * @return the result.
     */
    public static Result teardownError(FixtureTeardownException error, String testId) {
        ObjectChecker.assertNonNull(error);
        return new Result(Kind.TEARDOWN, testId, error.fixtureName, Outcome.ERROR, Failure.of(ErrorOrigin.FIXTURE_TEARDOWN, error.getCause()), null, 0, "", "");
    }

    /**
     * Returns the error record for a failed hook handler.
     *
     * @param error The hook failure.
     * @param testId The test that triggered the hook point, or null.
     * @return the result.
     */
    public static Result hookError(HookException error, String testId) {
        ObjectChecker.assertNonNull(error);
        return new Result(Kind.HOOK, testId, error.point + ":" + error.handlerName, Outcome.ERROR, Failure.of(ErrorOrigin.HOOK, error.getCause()), null, 0, "", "");
    }

    public boolean isTestResult() {
        return this.kind == Kind.TEST;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.kind + ": " + this.subject + ", outcome: " + this.outcome
                + ((this.failure != null) ? ", " + this.failure : "")
                + ((this.reason != null) ? ", reason: " + this.reason : "") + " }";
    }

    /**
     * Builds the result of a test.
     */
    public static final class Builder {
        private String testId;
        private Outcome outcome;
        private Failure failure;
        private String reason;
        private long durationNanos = 0;
        private String stdout = "";
        private String stderr = "";

        public static Builder forTest(String testId) {
            Builder builder = new Builder();
            builder.testId = testId;
            return builder;
        }

        public Builder passed() {
            this.outcome = Outcome.PASSED;
            return this;
        }

        public Builder failed(Failure failure) {
            this.outcome = (failure.origin == ErrorOrigin.TEST_BODY) && (failure.cause instanceof AssertionError) ? Outcome.FAILED : Outcome.ERROR;
            this.failure = failure;
            return this;
        }

        public Builder skipped(String reason) {
            this.outcome = Outcome.SKIPPED;
            this.reason = (reason == null) ? "skipped" : reason;
            return this;
        }

        public Builder interrupted(String reason) {
            this.outcome = Outcome.INTERRUPTED;
            this.reason = reason;
            return this;
        }

        public Builder durationNanos(long durationNanos) {
            ObjectChecker.assertNonNegative(durationNanos);
            this.durationNanos = durationNanos;
            return this;
        }

        public Builder capturedOutput(String stdout, String stderr) {
            ObjectChecker.assertNonNull(stdout, stderr);
            this.stdout = stdout;
            this.stderr = stderr;
            return this;
        }

        public Result build() {
            ObjectChecker.assertNonEmpty(this.testId);
            ObjectChecker.assertNonNull(this.outcome);
            return new Result(Kind.TEST, this.testId, this.testId, this.outcome, this.failure, this.reason, this.durationNanos, this.stdout, this.stderr);
        }
    }
}
