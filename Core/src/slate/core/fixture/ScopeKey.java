package slate.core.fixture;

import slate.core.util.ObjectChecker;

/**
 * Identifies one live activation of a scope: the scope kind plus the key of the activation (a test id, a module name,
 * or the single session key).
 */
public final class ScopeKey {
    public final Scope scope;
    public final String key;

    private ScopeKey(Scope scope, String key) {
        ObjectChecker.assertNonNull(scope, key);
        this.scope = scope;
        this.key = key;
    }

    public static ScopeKey of(Scope scope, String key) {
        return new ScopeKey(scope, key);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScopeKey)) {
            return false;
        }
        ScopeKey otherKey = (ScopeKey) other;
        return this.scope.equals(otherKey.scope) && this.key.equals(otherKey.key);
    }

    @Override
    public int hashCode() {
        return 31 * this.scope.hashCode() + this.key.hashCode();
    }

    @Override
    public String toString() {
        return this.scope + "[" + this.key + "]";
    }
}
