package slate.core.session;

import slate.core.util.ObjectChecker;

/**
 * A monitor shared by the session runner and its workers that records why the session must stop early.
 *
 * An abort is requested from outside the session (an interrupt, a user request) and is innocuous: the tests not yet
 * started are marked interrupted and the session finalizes normally. A panic is raised by a worker that crashed
 * unexpectedly; it aborts the session the same way, and the runner rethrows its cause once teardown has run.
 *
 * Either way, aborts are observed between tests: the tests already in flight complete first.
 *
 * This class is thread-safe and is intended to be used by multiple classes.
 */
public final class AbortMonitor {
    private final Object monitor = new Object();
    private String abortReason = null;
    private Throwable panic = null;

    /**
     * Requests that the session be aborted. Only the first reason is kept.
     *
     * @param reason Why the session is aborted.
     */
    public void requestAbort(String reason) {
        ObjectChecker.assertNonNull(reason);

        synchronized (this.monitor) {
            if (this.abortReason == null) {
                this.abortReason = reason;
                this.monitor.notifyAll();
            }
        }
    }

    /**
     * Alerts the session that an unexpected error has compromised it. If a panic already exists in this monitor then
     * this one is ignored, since any subsequent panics are handled the same way.
     *
     * @param error the fatal error.
     */
    void panic(Throwable error) {
        ObjectChecker.assertNonNull(error);

        synchronized (this.monitor) {
            if (this.panic == null) {
                this.panic = error;
            }
            if (this.abortReason == null) {
                this.abortReason = "panic: " + error;
            }
            this.monitor.notifyAll();
        }
    }

    public boolean isAbortRequested() {
        synchronized (this.monitor) {
            return this.abortReason != null;
        }
    }

    /**
     * Returns the reason of the abort, or null if no abort was requested.
     */
    public String getAbortReason() {
        synchronized (this.monitor) {
            return this.abortReason;
        }
    }

    /**
     * Returns the cause of the panic, or null if there was none.
     */
    Throwable getCauseOfPanic() {
        synchronized (this.monitor) {
            return this.panic;
        }
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { " + ((this.abortReason == null) ? "[running]" : "[aborted: " + this.abortReason + "]") + " }";
        }
    }
}
