package slate.core.fixture;

import slate.core.util.ObjectChecker;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The scope activations a single test lives in: its own test key, its module key, the session key and a key for every
 * custom scope. Custom scopes are narrower than modules, so their keys are qualified by the module key; a custom scope
 * the test does not name explicitly shares the module's key.
 */
public final class ScopePath {
    public static final String SESSION_KEY = "session";
    private final String testKey;
    private final String moduleKey;
    private final Map<String, String> customKeys;

    private ScopePath(String testKey, String moduleKey, Map<String, String> customKeys) {
        ObjectChecker.assertNonNull(testKey, moduleKey, customKeys);
        this.testKey = testKey;
        this.moduleKey = moduleKey;
        this.customKeys = Collections.unmodifiableMap(new HashMap<>(customKeys));
    }

    public static ScopePath of(String testKey, String moduleKey) {
        return new ScopePath(testKey, moduleKey, Collections.emptyMap());
    }

    public static ScopePath of(String testKey, String moduleKey, Map<String, String> customKeys) {
        return new ScopePath(testKey, moduleKey, customKeys);
    }

    /**
     * Returns the key of the activation of the given scope this path belongs to.
     */
    public String keyFor(Scope scope) {
        ObjectChecker.assertNonNull(scope);
        if (scope.equals(Scope.TEST)) {
            return this.testKey;
        } else if (scope.equals(Scope.MODULE)) {
            return this.moduleKey;
        } else if (scope.equals(Scope.SESSION)) {
            return SESSION_KEY;
        } else {
            String customKey = this.customKeys.get(scope.name);
            return (customKey == null) ? this.moduleKey : this.moduleKey + "/" + customKey;
        }
    }

    public ScopeKey scopeKeyFor(Scope scope) {
        return ScopeKey.of(scope, keyFor(scope));
    }

    public String getModuleKey() {
        return this.moduleKey;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { test: " + this.testKey + ", module: " + this.moduleKey + ", custom: " + this.customKeys + " }";
    }
}
