package slate.core.result;

import slate.core.util.ObjectChecker;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The session-level summary: counts of test results per outcome, counts of teardown and hook error records, the session
 * duration and whether the session was interrupted.
 */
public final class SessionSummary {
    private final Map<Outcome, Integer> testCounts;
    public final int numTeardownErrors;
    public final int numHookErrors;
    public final long durationNanos;
    public final boolean wasInterrupted;

    private SessionSummary(Map<Outcome, Integer> testCounts, int numTeardownErrors, int numHookErrors, long durationNanos, boolean wasInterrupted) {
        this.testCounts = Collections.unmodifiableMap(testCounts);
        this.numTeardownErrors = numTeardownErrors;
        this.numHookErrors = numHookErrors;
        this.durationNanos = durationNanos;
        this.wasInterrupted = wasInterrupted;
    }

    /**
     * Summarizes the given results.
     *
     * @param results All results recorded by the session.
     * @param durationNanos The session duration.
     * @param wasInterrupted Whether the session was aborted.
     * @return the summary.
     */
    public static SessionSummary summarize(List<Result> results, long durationNanos, boolean wasInterrupted) {
        ObjectChecker.assertNonNull(results);
        ObjectChecker.assertNonNegative(durationNanos);

        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0);
        }
        int teardownErrors = 0;
        int hookErrors = 0;
        for (Result result : results) {
            if (result.kind == Result.Kind.TEST) {
                counts.merge(result.outcome, 1, Integer::sum);
            } else if (result.kind == Result.Kind.TEARDOWN) {
                teardownErrors++;
            } else {
                hookErrors++;
            }
        }
        return new SessionSummary(counts, teardownErrors, hookErrors, durationNanos, wasInterrupted);
    }

    public int getCount(Outcome outcome) {
        return this.testCounts.get(outcome);
    }

    public int getTotalNumTests() {
        int total = 0;
        for (int count : this.testCounts.values()) {
            total += count;
        }
        return total;
    }

    /**
     * Returns the exit status of a session that ran: interrupted sessions report {@link ExitStatus#INTERRUPTED}, sessions
     * with a failed or errored test or any error record report {@link ExitStatus#TESTS_FAILED}.
     */
    public ExitStatus getExitStatus() {
        if (this.wasInterrupted) {
            return ExitStatus.INTERRUPTED;
        }
        boolean anyFailure = (getCount(Outcome.FAILED) > 0) || (getCount(Outcome.ERROR) > 0) || (this.numTeardownErrors > 0) || (this.numHookErrors > 0);
        return anyFailure ? ExitStatus.TESTS_FAILED : ExitStatus.SUCCESS;
    }

    /**
     * Returns the session duration in seconds, to four decimal places.
     */
    public String getDurationSeconds() {
        return nanosToSecondsString(this.durationNanos);
    }

    public static String nanosToSecondsString(long nanos) {
        return BigDecimal.valueOf(nanos)
                .divide(BigDecimal.valueOf(1_000_000_000L), 4, RoundingMode.HALF_DOWN)
                .toPlainString();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + getTotalNumTests() + ", " + this.testCounts
                + ", teardown errors: " + this.numTeardownErrors + ", hook errors: " + this.numHookErrors
                + ", duration: " + getDurationSeconds() + "s" + (this.wasInterrupted ? ", [interrupted]" : "") + " }";
    }
}
