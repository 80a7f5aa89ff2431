package slate.core.fixture;

import slate.core.util.ObjectChecker;

import java.util.Locale;

/**
 * The lifetime boundary of a fixture value.
 *
 * Scopes are ordered by level: {@link #TEST} is the narrowest and {@link #SESSION} the widest. Custom scopes nest
 * strictly between test and module, so an instance of a custom scope never spans more than one module.
 */
public final class Scope implements Comparable<Scope> {
    public static final Scope TEST = new Scope("test", 0);
    public static final Scope MODULE = new Scope("module", 100);
    public static final Scope SESSION = new Scope("session", 200);

    public final String name;
    public final int level;

    private Scope(String name, int level) {
        this.name = name;
        this.level = level;
    }

    /**
     * Declares a custom scope.
     *
     * @param name The scope name, distinct from the built-in scope names.
     * @param level The nesting level, strictly between {@link #TEST} and {@link #MODULE}.
     * @return the custom scope.
     */
    public static Scope custom(String name, int level) {
        ObjectChecker.assertNonEmpty(name);
        if (fromBuiltInName(name) != null) {
            throw new IllegalArgumentException("custom scope cannot reuse built-in scope name: " + name);
        }
        if ((level <= TEST.level) || (level >= MODULE.level)) {
            throw new IllegalArgumentException("custom scope level must lie strictly between " + TEST.level + " and " + MODULE.level + " but was: " + level);
        }
        return new Scope(name, level);
    }

    /**
     * Returns the built-in scope with the given name (case-insensitive), or null if there is none.
     */
    public static Scope fromBuiltInName(String name) {
        ObjectChecker.assertNonNull(name);
        switch (name.toLowerCase(Locale.ROOT)) {
            case "test": return TEST;
            case "module": return MODULE;
            case "session": return SESSION;
            default: return null;
        }
    }

    public boolean isNarrowerThan(Scope other) {
        return this.level < other.level;
    }

    public boolean isCustom() {
        return (this.level > TEST.level) && (this.level < MODULE.level);
    }

    @Override
    public int compareTo(Scope other) {
        int byLevel = Integer.compare(this.level, other.level);
        return (byLevel != 0) ? byLevel : this.name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Scope)) {
            return false;
        }
        Scope otherScope = (Scope) other;
        return (this.level == otherScope.level) && this.name.equals(otherScope.name);
    }

    @Override
    public int hashCode() {
        return 31 * this.name.hashCode() + this.level;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
