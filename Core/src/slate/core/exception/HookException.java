package slate.core.exception;

import slate.core.hook.HookPoint;

/**
 * Describes the failure of a single hook handler. Hook failures are isolated: they are recorded as their own result and
 * never change the outcome of the test that triggered the hook point.
 */
public final class HookException extends Exception {
    public final HookPoint point;
    public final String handlerName;

    public HookException(HookPoint point, String handlerName, Throwable cause) {
        super("Handler '" + handlerName + "' for hook point " + point + " failed: " + FixtureSetupException.describe(cause), cause);
        this.point = point;
        this.handlerName = handlerName;
    }
}
