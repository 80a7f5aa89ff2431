package slate.core.fixture;

import slate.core.exception.FixtureSetupException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A live activation of a scope. Caches the fixture values built for it, the setup failures it has seen, and the pending
 * teardown actions in construction order.
 *
 * All state is guarded by {@link #monitor}, which {@link FixtureStore} holds only while getting or constructing a single
 * fixture, never across a test body.
 */
public final class ScopeInstance {
    final Object monitor = new Object();
    private final ScopeKey scopeKey;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Throwable> failures = new HashMap<>();
    private final Deque<PendingTeardown> teardowns = new ArrayDeque<>();
    private int constructions = 0;
    private boolean isClosed = false;

    ScopeInstance(ScopeKey scopeKey) {
        this.scopeKey = scopeKey;
    }

    public ScopeKey getScopeKey() {
        return this.scopeKey;
    }

    /**
     * Returns the names of the fixtures whose values are cached in this instance, in construction order.
     */
    public List<String> getCachedFixtureNames() {
        synchronized (this.monitor) {
            return new ArrayList<>(this.values.keySet());
        }
    }

    public int getNumPendingTeardowns() {
        synchronized (this.monitor) {
            return this.teardowns.size();
        }
    }

    /**
     * Returns the number of successful factory invocations in this instance.
     */
    public int getNumConstructions() {
        synchronized (this.monitor) {
            return this.constructions;
        }
    }

    boolean hasValue(String name) {
        return this.values.containsKey(name);
    }

    Object getValue(String name) {
        return this.values.get(name);
    }

    void putValue(String name, Object value) {
        this.values.put(name, value);
        this.constructions++;
    }

    /**
     * Rethrows the cached setup failure of the given fixture, if any.
     */
    void rethrowCachedFailure(String name) throws FixtureSetupException {
        Throwable failure = this.failures.get(name);
        if (failure != null) {
            throw new FixtureSetupException(name, failure);
        }
    }

    void putFailure(String name, Throwable failure) {
        this.failures.put(name, failure);
    }

    void addTeardown(String fixtureName, TeardownAction action) {
        synchronized (this.monitor) {
            if (this.isClosed) {
                throw new IllegalStateException("Cannot add teardown for '" + fixtureName + "': " + this.scopeKey + " is closed.");
            }
            this.teardowns.addLast(new PendingTeardown(fixtureName, action));
        }
    }

    boolean isClosed() {
        return this.isClosed;
    }

    /**
     * Marks this instance closed and hands out its pending teardowns, last constructed first.
     */
    List<PendingTeardown> close() {
        List<PendingTeardown> reversed = new ArrayList<>();
        this.isClosed = true;
        while (!this.teardowns.isEmpty()) {
            reversed.add(this.teardowns.pollLast());
        }
        return reversed;
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { " + this.scopeKey + ", cached: " + this.values.keySet() + ", pending teardowns: " + this.teardowns.size() + (this.isClosed ? ", [closed]" : "") + " }";
        }
    }

    static final class PendingTeardown {
        final String fixtureName;
        final TeardownAction action;

        private PendingTeardown(String fixtureName, TeardownAction action) {
            this.fixtureName = fixtureName;
            this.action = action;
        }
    }
}
