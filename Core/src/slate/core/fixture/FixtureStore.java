package slate.core.fixture;

import slate.core.exception.FixtureSetupException;
import slate.core.exception.FixtureTeardownException;
import slate.core.exception.UnknownFixtureException;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Instantiates fixture values, caches them per scope instance and owns their teardown.
 *
 * Scope instances are created lazily on first use. A fixture is constructed at most once per scope instance: concurrent
 * requests for the same instance wait on that instance's monitor and then read the cached value (or the cached setup
 * failure). Only one instance monitor is ever held at a time, and never while a test body runs.
 *
 * This class is thread-safe.
 */
public final class FixtureStore {
    private static final Logger LOGGER = Logger.forClass(FixtureStore.class);
    private final FixtureGraph graph;
    private final ConcurrentMap<ScopeKey, ScopeInstance> instances = new ConcurrentHashMap<>();

    private FixtureStore(FixtureGraph graph) {
        ObjectChecker.assertNonNull(graph);
        if (!graph.isValidated()) {
            throw new IllegalArgumentException("fixture graph must be validated before building a store over it.");
        }
        this.graph = graph;
    }

    /**
     * Creates an empty store over the given validated graph.
     *
     * @param graph The validated fixture graph.
     * @return the new store.
     */
    public static FixtureStore forGraph(FixtureGraph graph) {
        return new FixtureStore(graph);
    }

    /**
     * Returns the value of the named fixture for the scope activations of the given path, constructing it and any of
     * its unmet dependencies first. Every construction registers its teardown actions in the owning scope instance.
     *
     * If any factory along the way fails, construction stops there and the failure is raised. Values already cached in
     * other scope instances stay cached.
     *
     * @param name The fixture name.
     * @param path The scope activations of the requesting test.
     * @return the fixture value.
     * @throws FixtureSetupException If the fixture or one of its dependencies cannot be constructed.
     */
    public Object get(String name, ScopePath path) throws FixtureSetupException {
        ObjectChecker.assertNonNull(name, path);

        List<String> order;
        try {
            order = this.graph.resolutionOrder(Collections.singletonList(name));
        } catch (UnknownFixtureException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }

        Object value = null;
        for (String fixtureName : order) {
            value = getOrConstruct(this.graph.getDefinition(fixtureName), path);
        }
        return value;
    }

    /**
     * Closes the given scope activation: runs all of its pending teardown actions in strict reverse construction order
     * and discards it. A failing teardown does not stop the others; every failure is returned, in execution order.
     *
     * Closing an activation that is not open does nothing.
     *
     * @param scope The scope kind.
     * @param key The activation key.
     * @return the teardown failures.
     */
    public List<FixtureTeardownException> closeScope(Scope scope, String key) {
        ObjectChecker.assertNonNull(scope, key);
        ScopeKey scopeKey = ScopeKey.of(scope, key);
        ScopeInstance instance = this.instances.remove(scopeKey);
        if (instance == null) {
            return Collections.emptyList();
        }

        List<ScopeInstance.PendingTeardown> teardowns;
        synchronized (instance.monitor) {
            teardowns = instance.close();
        }

        LOGGER.log("Closing " + scopeKey + " with " + teardowns.size() + " pending teardowns.");
        List<FixtureTeardownException> failures = new ArrayList<>();
        for (ScopeInstance.PendingTeardown teardown : teardowns) {
            try {
                teardown.action.teardown();
            } catch (Throwable t) {
                LOGGER.warn("Teardown of '" + teardown.fixtureName + "' in " + scopeKey + " failed.", t);
                failures.add(new FixtureTeardownException(teardown.fixtureName, scopeKey.toString(), t));
            }
        }
        return failures;
    }

    /**
     * Returns the open scope activations, narrowest scope first.
     */
    public List<ScopeKey> getOpenScopeKeys() {
        List<ScopeKey> keys = new ArrayList<>(this.instances.keySet());
        keys.sort((first, second) -> {
            int byScope = first.scope.compareTo(second.scope);
            return (byScope != 0) ? byScope : first.key.compareTo(second.key);
        });
        return keys;
    }

    /**
     * Returns the open activation for the given scope and key, or null if it is not open.
     */
    public ScopeInstance getScopeInstance(Scope scope, String key) {
        return this.instances.get(ScopeKey.of(scope, key));
    }

    public FixtureGraph getGraph() {
        return this.graph;
    }

    private Object getOrConstruct(FixtureDefinition definition, ScopePath path) throws FixtureSetupException {
        ScopeKey scopeKey = path.scopeKeyFor(definition.scope);

        // Dependencies were resolved before this fixture, so they are already cached; read them before taking our own lock.
        Map<String, Object> dependencyValues = new HashMap<>();
        for (String dependencyName : definition.dependencies) {
            dependencyValues.put(dependencyName, readCached(this.graph.getDefinition(dependencyName), path));
        }

        ScopeInstance instance = this.instances.computeIfAbsent(scopeKey, ScopeInstance::new);
        synchronized (instance.monitor) {
            if (instance.isClosed()) {
                throw new IllegalStateException("Cannot construct '" + definition.name + "': " + scopeKey + " was closed while in use.");
            }
            if (instance.hasValue(definition.name)) {
                return instance.getValue(definition.name);
            }
            instance.rethrowCachedFailure(definition.name);

            LOGGER.log("Constructing fixture '" + definition.name + "' for " + scopeKey);
            try {
                Object value = definition.factory.create(new FixtureContext(definition, scopeKey, dependencyValues, instance));
                instance.putValue(definition.name, value);
                return value;
            } catch (Throwable t) {
                LOGGER.warn("Factory of fixture '" + definition.name + "' failed for " + scopeKey, t);
                instance.putFailure(definition.name, t);
                throw new FixtureSetupException(definition.name, t);
            }
        }
    }

    private Object readCached(FixtureDefinition definition, ScopePath path) throws FixtureSetupException {
        ScopeInstance instance = this.instances.get(path.scopeKeyFor(definition.scope));
        if (instance == null) {
            throw new IllegalStateException("Dependency '" + definition.name + "' was not constructed before its dependent.");
        }
        synchronized (instance.monitor) {
            if (instance.hasValue(definition.name)) {
                return instance.getValue(definition.name);
            }
            instance.rethrowCachedFailure(definition.name);
            throw new IllegalStateException("Dependency '" + definition.name + "' was not constructed before its dependent.");
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { open scopes: " + getOpenScopeKeys() + " }";
    }
}
