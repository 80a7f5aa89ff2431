package slate.core.collect;

import slate.core.fixture.ScopePath;
import slate.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A collected test: a stable id, the module it belongs to, the ordered names of the fixtures it requires and its body.
 * Immutable once collected.
 *
 * {@link #skipReason} is non-null when the test is marked to be skipped by its metadata.
 */
public final class TestCase {
    public static final String DEFAULT_MODULE = "<default>";
    public final String id;
    public final String moduleKey;
    public final List<String> requiredFixtures;
    public final TestBody body;
    public final String skipReason;
    private final ScopePath scopePath;

    private TestCase(String id, String moduleKey, List<String> requiredFixtures, TestBody body, String skipReason, Map<String, String> customScopeKeys) {
        this.id = id;
        this.moduleKey = moduleKey;
        this.requiredFixtures = Collections.unmodifiableList(new ArrayList<>(requiredFixtures));
        this.body = body;
        this.skipReason = skipReason;
        this.scopePath = ScopePath.of(id, moduleKey, customScopeKeys);
    }

    /**
     * Returns the scope activations this test runs in.
     */
    public ScopePath getScopePath() {
        return this.scopePath;
    }

    public boolean isMarkedSkip() {
        return this.skipReason != null;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { id: " + this.id + ", module: " + this.moduleKey + ", fixtures: " + this.requiredFixtures + (isMarkedSkip() ? ", [skip]" : "") + " }";
    }

    public static final class Builder {
        private String id;
        private String moduleKey;
        private final List<String> requiredFixtures = new ArrayList<>();
        private TestBody body;
        private String skipReason;
        private final Map<String, String> customScopeKeys = new HashMap<>();

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder module(String moduleKey) {
            this.moduleKey = moduleKey;
            return this;
        }

        public Builder requires(String... fixtureNames) {
            this.requiredFixtures.addAll(Arrays.asList(fixtureNames));
            return this;
        }

        public Builder requires(List<String> fixtureNames) {
            this.requiredFixtures.addAll(fixtureNames);
            return this;
        }

        public Builder body(TestBody body) {
            this.body = body;
            return this;
        }

        public Builder skip(String reason) {
            this.skipReason = reason;
            return this;
        }

        /**
         * Sets the key of this test's activation of the named custom scope.
         */
        public Builder customScopeKey(String scopeName, String key) {
            this.customScopeKeys.put(scopeName, key);
            return this;
        }

        public TestCase build() {
            ObjectChecker.assertNonEmpty(this.id);
            ObjectChecker.assertNonNull(this.body);
            ObjectChecker.assertNoNullElements(this.requiredFixtures);
            String module = (this.moduleKey == null) ? DEFAULT_MODULE : this.moduleKey;
            return new TestCase(this.id, module, this.requiredFixtures, this.body, this.skipReason, this.customScopeKeys);
        }
    }
}
