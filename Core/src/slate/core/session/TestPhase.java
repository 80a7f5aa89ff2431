package slate.core.session;

/**
 * The phases a single test moves through. A skipped test goes from {@link #PENDING} to {@link #DONE} without setup, and
 * a test whose fixtures cannot be built goes from {@link #SETTING_UP} to {@link #TEARING_DOWN} without executing.
 */
public enum TestPhase {
    PENDING,
    SETTING_UP,
    EXECUTING,
    TEARING_DOWN,
    DONE
}
