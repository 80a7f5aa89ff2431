package slate.core.fixture;

import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The declaration of a fixture: its name, its scope, the names of the fixtures it depends on and the factory that
 * produces its value. Definitions are immutable once built.
 */
public final class FixtureDefinition {
    public final String name;
    public final Scope scope;
    public final List<String> dependencies;
    public final FixtureFactory factory;

    private FixtureDefinition(String name, Scope scope, List<String> dependencies, FixtureFactory factory) {
        this.name = name;
        this.scope = scope;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.factory = factory;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + ", scope: " + this.scope + ", dependencies: " + this.dependencies + " }";
    }

    public static final class Builder {
        private String name;
        private Scope scope = Scope.TEST;
        private final List<String> dependencies = new ArrayList<>();
        private FixtureFactory factory;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder dependsOn(String... names) {
            this.dependencies.addAll(Arrays.asList(names));
            return this;
        }

        public Builder dependsOn(List<String> names) {
            this.dependencies.addAll(names);
            return this;
        }

        public Builder factory(FixtureFactory factory) {
            this.factory = factory;
            return this;
        }

        public FixtureDefinition build() {
            ObjectChecker.assertNonEmpty(this.name);
            ObjectChecker.assertNonNull(this.scope, this.factory);
            ObjectChecker.assertNoNullElements(this.dependencies);
            if (this.dependencies.size() != this.dependencies.stream().distinct().count()) {
                throw new IllegalArgumentException("fixture '" + this.name + "' lists a dependency more than once: " + this.dependencies);
            }
            return new FixtureDefinition(this.name, this.scope, this.dependencies, this.factory);
        }
    }
}
