package slate.core.fixture;

import slate.core.util.ObjectChecker;

import java.util.Map;

/**
 * Handed to a {@link FixtureFactory} while it constructs a fixture value.
 *
 * Only the declared dependencies of the fixture are visible. Teardown actions are committed to the owning scope
 * instance the moment they are added, so they run when that instance closes even if the factory fails afterwards.
 */
public final class FixtureContext {
    private final FixtureDefinition definition;
    private final ScopeKey scopeKey;
    private final Map<String, Object> dependencyValues;
    private final ScopeInstance owner;

    FixtureContext(FixtureDefinition definition, ScopeKey scopeKey, Map<String, Object> dependencyValues, ScopeInstance owner) {
        this.definition = definition;
        this.scopeKey = scopeKey;
        this.dependencyValues = dependencyValues;
        this.owner = owner;
    }

    public String getFixtureName() {
        return this.definition.name;
    }

    public Scope getScope() {
        return this.definition.scope;
    }

    /**
     * Returns the key of the scope activation the value is constructed for, e.g. the module name for a module fixture.
     */
    public String getScopeKey() {
        return this.scopeKey.key;
    }

    /**
     * Returns the value of a declared dependency.
     *
     * @param dependencyName The name of the dependency.
     * @return the dependency's value.
     */
    public Object getValue(String dependencyName) {
        ObjectChecker.assertNonNull(dependencyName);
        if (!this.dependencyValues.containsKey(dependencyName)) {
            throw new IllegalArgumentException("'" + dependencyName + "' is not a declared dependency of fixture '" + this.definition.name + "'.");
        }
        return this.dependencyValues.get(dependencyName);
    }

    /**
     * Returns the value of a declared dependency cast to the given type.
     */
    public <T> T getValue(String dependencyName, Class<T> type) {
        return type.cast(getValue(dependencyName));
    }

    /**
     * Registers an action to run when the scope instance owning this fixture closes. Actions run in reverse order of
     * registration across all fixtures of the instance.
     *
     * @param action The teardown action.
     */
    public void addTeardown(TeardownAction action) {
        ObjectChecker.assertNonNull(action);
        this.owner.addTeardown(this.definition.name, action);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { fixture: " + this.definition.name + ", scope: " + this.scopeKey + " }";
    }
}
