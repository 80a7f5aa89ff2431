package slate.core.hook;

/**
 * The fixed set of lifecycle moments at which registered handlers are invoked.
 */
public enum HookPoint {
    /** The session has started, before collection. */
    SESSION_START,
    /** A test is about to set up its fixtures. Handlers may request a skip. */
    BEFORE_TEST,
    /** A test has finished, after its test-scoped fixtures were torn down. */
    AFTER_TEST,
    /**
     * A test result that is not a pass, or a fixture teardown error record, was recorded. For a test it fires after the
     * test's teardown. Hook error records never fire it.
     */
    ON_ERROR,
    /** The session is about to close its remaining scopes. */
    BEFORE_SESSION_CLEANUP,
    /** The session has closed all scopes. Always the last point invoked. */
    SESSION_END
}
