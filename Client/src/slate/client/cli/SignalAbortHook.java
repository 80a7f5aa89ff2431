package slate.client.cli;

import slate.core.result.ExitStatus;
import slate.core.session.SessionRunner;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * The shutdown hook installed while a session runs from the command line.
 *
 * On a signal it aborts the session, waits for it to finalize and then halts the process with the session's own exit
 * code. Halting is required: once the JVM is shutting down, the exit code of {@code System.exit} called from the main
 * thread is ignored in favor of the signal's.
 */
final class SignalAbortHook implements Runnable {
    private static final Logger LOGGER = Logger.forClass(SignalAbortHook.class);
    static final String ABORT_REASON = "interrupted by signal";
    private final SessionRunner runner;
    private final long graceSeconds;
    private final IntConsumer halter;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile int exitCode = ExitStatus.INTERRUPTED.code;

    SignalAbortHook(SessionRunner runner, long graceSeconds, IntConsumer halter) {
        ObjectChecker.assertNonNull(runner, halter);
        ObjectChecker.assertNonNegative(graceSeconds);
        this.runner = runner;
        this.graceSeconds = graceSeconds;
        this.halter = halter;
    }

    /**
     * Called once the session has produced its exit code.
     */
    void sessionFinished(int exitCode) {
        this.exitCode = exitCode;
        this.finished.countDown();
    }

    @Override
    public void run() {
        this.runner.abort(ABORT_REASON);
        try {
            if (!this.finished.await(this.graceSeconds, TimeUnit.SECONDS)) {
                System.err.println("Session did not finalize within " + this.graceSeconds + " seconds of the interrupt.");
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while awaiting the session to finalize.", e);
            Thread.currentThread().interrupt();
        }

        System.out.flush();
        System.err.flush();
        this.halter.accept(this.exitCode);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { runner: " + this.runner + ", grace: " + this.graceSeconds + "s }";
    }
}
