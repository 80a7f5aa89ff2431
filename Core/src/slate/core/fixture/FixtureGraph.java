package slate.core.fixture;

import slate.core.exception.CyclicDependencyException;
import slate.core.exception.DuplicateFixtureException;
import slate.core.exception.FixtureGraphException;
import slate.core.exception.ScopeMismatchException;
import slate.core.exception.UnknownFixtureException;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * The static set of declared fixtures and the dependency edges between them.
 *
 * Fixtures are registered during collection and the graph is then validated exactly once. Validation resolves every
 * dependency name into a declaration index, so after {@link #validate()} the graph is read-only and all resolution works
 * on that index table rather than on names. Ties in every ordering are broken by declaration order.
 *
 * This class is thread-safe.
 */
public final class FixtureGraph {
    private static final Logger LOGGER = Logger.forClass(FixtureGraph.class);
    private static final int UNVISITED = 0;
    private static final int VISITING = 1;
    private static final int VISITED = 2;
    private final List<FixtureDefinition> declared = new ArrayList<>();
    private final Map<String, Integer> idsByName = new HashMap<>();
    private int[][] dependencyIds = null;

    /**
     * Registers a fixture definition.
     *
     * @param definition The definition to register.
     * @throws DuplicateFixtureException If a fixture of the same name is already registered.
     */
    public synchronized void register(FixtureDefinition definition) throws DuplicateFixtureException {
        ObjectChecker.assertNonNull(definition);
        if (isValidated()) {
            throw new IllegalStateException("Cannot register fixture '" + definition.name + "': graph is already validated.");
        }
        if (this.idsByName.containsKey(definition.name)) {
            throw new DuplicateFixtureException(definition.name);
        }
        this.idsByName.put(definition.name, this.declared.size());
        this.declared.add(definition);
        LOGGER.log("Registered " + definition);
    }

    /**
     * Validates the graph: every dependency must be registered, the dependency edges must be acyclic and no fixture may
     * depend on a fixture of narrower scope. On success the resolved dependency table is built and the graph becomes
     * read-only. Validating an already validated graph does nothing.
     *
     * @throws UnknownFixtureException If a dependency names an unregistered fixture.
     * @throws CyclicDependencyException If the dependency edges contain a cycle.
     * @throws ScopeMismatchException If a fixture depends on a narrower-scoped fixture.
     */
    public synchronized void validate() throws FixtureGraphException {
        if (isValidated()) {
            return;
        }

        int[][] resolved = new int[this.declared.size()][];
        for (int id = 0; id < this.declared.size(); id++) {
            FixtureDefinition definition = this.declared.get(id);
            resolved[id] = new int[definition.dependencies.size()];
            for (int i = 0; i < definition.dependencies.size(); i++) {
                Integer dependencyId = this.idsByName.get(definition.dependencies.get(i));
                if (dependencyId == null) {
                    throw new UnknownFixtureException(definition.dependencies.get(i), "fixture '" + definition.name + "'");
                }
                resolved[id][i] = dependencyId;
            }
            Arrays.sort(resolved[id]);
        }

        int[] state = new int[this.declared.size()];
        for (int id = 0; id < this.declared.size(); id++) {
            if (state[id] == UNVISITED) {
                List<Integer> cycle = findCycle(id, resolved, state, new ArrayList<>());
                if (cycle != null) {
                    List<String> names = new ArrayList<>();
                    for (int member : cycle) {
                        names.add(this.declared.get(member).name);
                    }
                    throw new CyclicDependencyException(names);
                }
            }
        }

        for (int id = 0; id < this.declared.size(); id++) {
            FixtureDefinition definition = this.declared.get(id);
            for (int dependencyId : resolved[id]) {
                FixtureDefinition dependency = this.declared.get(dependencyId);
                if (dependency.scope.isNarrowerThan(definition.scope)) {
                    throw new ScopeMismatchException(definition.name, definition.scope.name, dependency.name, dependency.scope.name);
                }
            }
        }

        this.dependencyIds = resolved;
        LOGGER.log("Validated fixture graph of " + this.declared.size() + " fixtures.");
    }

    public synchronized boolean isValidated() {
        return this.dependencyIds != null;
    }

    /**
     * Returns the post-order sequence of fixture names needed to satisfy the requested fixtures: every fixture appears
     * after all of its transitive dependencies and exactly once. Requested fixtures and dependencies are visited in
     * declaration order, so identical inputs always produce the identical sequence.
     *
     * @param names The requested fixture names.
     * @return the resolution order.
     * @throws UnknownFixtureException If a requested name is not registered.
     */
    public synchronized List<String> resolutionOrder(Collection<String> names) throws UnknownFixtureException {
        ObjectChecker.assertNoNullElements(names);
        if (!isValidated()) {
            throw new IllegalStateException("Cannot resolve fixtures: graph is not validated.");
        }

        TreeSet<Integer> roots = new TreeSet<>();
        for (String name : names) {
            Integer id = this.idsByName.get(name);
            if (id == null) {
                throw new UnknownFixtureException(name, "resolution request");
            }
            roots.add(id);
        }

        boolean[] emitted = new boolean[this.declared.size()];
        List<String> order = new ArrayList<>();
        for (int root : roots) {
            appendPostOrder(root, emitted, order);
        }
        return order;
    }

    /**
     * Returns the definition registered under the given name, or null if there is none.
     */
    public synchronized FixtureDefinition getDefinition(String name) {
        Integer id = this.idsByName.get(name);
        return (id == null) ? null : this.declared.get(id);
    }

    public synchronized boolean contains(String name) {
        return this.idsByName.containsKey(name);
    }

    /**
     * Returns all registered definitions in declaration order.
     */
    public synchronized List<FixtureDefinition> getDefinitions() {
        return new ArrayList<>(this.declared);
    }

    public synchronized int size() {
        return this.declared.size();
    }

    private void appendPostOrder(int id, boolean[] emitted, List<String> order) {
        if (emitted[id]) {
            return;
        }
        for (int dependencyId : this.dependencyIds[id]) {
            appendPostOrder(dependencyId, emitted, order);
        }
        emitted[id] = true;
        order.add(this.declared.get(id).name);
    }

    private static List<Integer> findCycle(int id, int[][] resolved, int[] state, List<Integer> path) {
        state[id] = VISITING;
        path.add(id);
        for (int dependencyId : resolved[id]) {
            if (state[dependencyId] == VISITING) {
                List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(dependencyId), path.size()));
                cycle.add(dependencyId);
                return cycle;
            }
            if (state[dependencyId] == UNVISITED) {
                List<Integer> cycle = findCycle(dependencyId, resolved, state, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        state[id] = VISITED;
        return null;
    }

    @Override
    public synchronized String toString() {
        return this.getClass().getSimpleName() + " { fixtures: " + this.declared.size() + (isValidated() ? ", [validated]" : "") + " }";
    }
}
