package slate.core.exception;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the fixture dependency edges contain a cycle.
 *
 * {@link #cycle} lists the fixtures on the cycle in dependency order, starting and ending with the same fixture.
 */
public final class CyclicDependencyException extends FixtureGraphException {
    public final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic fixture dependency: " + String.join(" -> ", cycle));
        this.cycle = Collections.unmodifiableList(cycle);
    }
}
