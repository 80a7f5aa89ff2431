package slate.client.output;

import slate.core.result.Outcome;
import slate.core.result.Result;
import slate.core.result.ResultListener;
import slate.core.result.SessionSummary;
import slate.core.util.ObjectChecker;

import java.io.PrintStream;

/**
 * Prints every result as it is recorded and the session summary once the session closes.
 *
 * Captured output of a test is printed beneath its result. Results arrive one at a time, so this reporter does not
 * need to synchronize.
 */
public final class ConsoleReporter implements ResultListener {
    private static final String RULE = "===============================================================";
    private final PrintStream out;
    private final PrintStream err;
    private boolean hasPrintedHeader = false;

    private ConsoleReporter(PrintStream out, PrintStream err) {
        ObjectChecker.assertNonNull(out, err);
        this.out = out;
        this.err = err;
    }

    /**
     * Creates a reporter printing to the given streams. The streams should be the console's, not the thread local
     * streams installed while output is captured.
     */
    public static ConsoleReporter toStreams(PrintStream out, PrintStream err) {
        return new ConsoleReporter(out, err);
    }

    @Override
    public void onResult(Result result) {
        printHeaderOnce();

        if (result.isTestResult()) {
            this.out.println("\nTEST RESULT:");
            this.out.println("\tTest: " + result.testId);
            this.out.println("\t" + result.outcome + describeOutcome(result));
        } else {
            this.out.println("\n" + result.kind + " ERROR:");
            this.out.println("\t" + result.subject + ((result.testId != null) ? ", during test: " + result.testId : ""));
            this.out.println("\t" + result.failure);
        }

        if (!result.capturedStdout.isEmpty()) {
            this.out.println("\t---- stdout ----");
            this.out.print(result.capturedStdout);
            this.out.println("\t----------------");
        }
        if (!result.capturedStderr.isEmpty()) {
            this.err.println("\t---- stderr ----");
            this.err.print(result.capturedStderr);
            this.err.println("\t----------------");
        }
    }

    @Override
    public void onSessionFinished(SessionSummary summary) {
        printHeaderOnce();
        this.out.println("\nSESSION RESULT:");
        this.out.println("\tTests: " + summary.getTotalNumTests()
                + ", passed: " + summary.getCount(Outcome.PASSED)
                + ", failed: " + summary.getCount(Outcome.FAILED)
                + ", errors: " + summary.getCount(Outcome.ERROR)
                + ", skipped: " + summary.getCount(Outcome.SKIPPED)
                + ", interrupted: " + summary.getCount(Outcome.INTERRUPTED));
        if ((summary.numTeardownErrors > 0) || (summary.numHookErrors > 0)) {
            this.out.println("\tTeardown errors: " + summary.numTeardownErrors + ", hook errors: " + summary.numHookErrors);
        }
        this.out.println("\tDuration: " + summary.getDurationSeconds());
        this.out.println("\tStatus: " + summary.getExitStatus());
        this.out.println(RULE);
    }

    private void printHeaderOnce() {
        if (!this.hasPrintedHeader) {
            this.out.println("\n" + RULE);
            this.hasPrintedHeader = true;
        }
    }

    private static String describeOutcome(Result result) {
        switch (result.outcome) {
            case PASSED:
                return ", duration: " + SessionSummary.nanosToSecondsString(result.durationNanos);
            case FAILED:
            case ERROR:
                return ", duration: " + SessionSummary.nanosToSecondsString(result.durationNanos) + ", " + result.failure;
            default:
                return ", reason: " + result.reason;
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
