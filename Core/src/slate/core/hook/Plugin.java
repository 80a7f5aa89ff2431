package slate.core.hook;

/**
 * An independently authored extension. A plugin only ever interacts with a session through the handlers it registers.
 */
public interface Plugin {

    /**
     * Returns the name the plugin's handlers are reported under.
     */
    public String getName();

    /**
     * Registers the plugin's handlers.
     *
     * @param dispatcher The session's dispatcher.
     */
    public void activate(HookDispatcher dispatcher);
}
