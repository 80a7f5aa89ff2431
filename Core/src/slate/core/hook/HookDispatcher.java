package slate.core.hook;

import slate.core.exception.HookException;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Invokes the handlers registered for each {@link HookPoint}, in registration order and synchronously on the calling
 * thread. The dispatcher knows nothing about its handlers beyond the {@link HookHandler} contract.
 *
 * This class is thread-safe: registration and invocation may happen concurrently, and an invocation sees the handlers
 * registered at the moment it started.
 */
public final class HookDispatcher {
    private static final Logger LOGGER = Logger.forClass(HookDispatcher.class);
    private final Map<HookPoint, List<RegisteredHandler>> handlers = new EnumMap<>(HookPoint.class);

    public HookDispatcher() {
        for (HookPoint point : HookPoint.values()) {
            this.handlers.put(point, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Registers a handler for the given point, reported under its class name.
     */
    public void register(HookPoint point, HookHandler handler) {
        ObjectChecker.assertNonNull(point, handler);
        register(point, handler.getClass().getName(), handler);
    }

    /**
     * Registers a handler for the given point, reported under the given name.
     *
     * @param point The hook point.
     * @param handlerName The name failures of this handler are reported under.
     * @param handler The handler.
     */
    public void register(HookPoint point, String handlerName, HookHandler handler) {
        ObjectChecker.assertNonNull(point, handlerName, handler);
        this.handlers.get(point).add(new RegisteredHandler(handlerName, handler));
        LOGGER.log("Registered handler '" + handlerName + "' for " + point);
    }

    /**
     * Activates the given plugin against this dispatcher.
     */
    public void activate(Plugin plugin) {
        ObjectChecker.assertNonNull(plugin);
        LOGGER.log("Activating plugin: " + plugin.getName());
        plugin.activate(this);
    }

    /**
     * Calls every handler registered for the context's point, in registration order. A failing handler does not stop
     * the remaining handlers; each failure is captured and returned, in invocation order.
     *
     * @param context The context handed to every handler.
     * @return the handler failures.
     */
    public List<HookException> invoke(HookContext context) {
        ObjectChecker.assertNonNull(context);
        List<RegisteredHandler> registered = this.handlers.get(context.point);
        if (registered.isEmpty()) {
            return Collections.emptyList();
        }

        List<HookException> failures = new ArrayList<>();
        for (RegisteredHandler handler : registered) {
            try {
                handler.handler.handle(context);
            } catch (Throwable t) {
                LOGGER.warn("Handler '" + handler.name + "' failed at " + context.point, t);
                failures.add(new HookException(context.point, handler.name, t));
            }
        }
        return failures;
    }

    public int getNumHandlers(HookPoint point) {
        ObjectChecker.assertNonNull(point);
        return this.handlers.get(point).size();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(this.getClass().getSimpleName()).append(" {");
        for (Map.Entry<HookPoint, List<RegisteredHandler>> entry : this.handlers.entrySet()) {
            builder.append(' ').append(entry.getKey()).append(": ").append(entry.getValue().size());
        }
        return builder.append(" }").toString();
    }

    private static final class RegisteredHandler {
        private final String name;
        private final HookHandler handler;

        private RegisteredHandler(String name, HookHandler handler) {
            this.name = name;
            this.handler = handler;
        }
    }
}
