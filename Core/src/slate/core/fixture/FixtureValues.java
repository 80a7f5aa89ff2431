package slate.core.fixture;

import slate.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The fixture values a test body receives, keyed by fixture name.
 */
public final class FixtureValues {
    private final Map<String, Object> values;

    private FixtureValues(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FixtureValues of(Map<String, Object> values) {
        ObjectChecker.assertNonNull(values);
        return new FixtureValues(values);
    }

    /**
     * Returns the value of the named fixture.
     */
    public Object get(String name) {
        ObjectChecker.assertNonNull(name);
        if (!this.values.containsKey(name)) {
            throw new IllegalArgumentException("test did not require fixture: " + name);
        }
        return this.values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public Set<String> names() {
        return this.values.keySet();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.values.keySet() + " }";
    }
}
