package slate.core.hook;

/**
 * A handler invoked at a {@link HookPoint}.
 *
 * Anything a handler throws is isolated: it is recorded as a hook error and neither stops the other handlers of the
 * point nor changes the outcome of the test that triggered the point.
 */
@FunctionalInterface
public interface HookHandler {

    public void handle(HookContext context) throws Exception;
}
