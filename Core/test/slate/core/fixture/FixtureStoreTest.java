package slate.core.fixture;

import org.junit.Assert;
import org.junit.Test;
import slate.core.exception.FixtureGraphException;
import slate.core.exception.FixtureSetupException;
import slate.core.exception.FixtureTeardownException;
import slate.core.helper.AssertHelper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

public class FixtureStoreTest {
    private static final ScopePath FIRST_TEST = ScopePath.of("m1#t1", "m1");
    private static final ScopePath SECOND_TEST = ScopePath.of("m1#t2", "m1");
    private static final ScopePath OTHER_MODULE_TEST = ScopePath.of("m2#t1", "m2");

    @Test
    public void testValueIsCachedPerScopeInstance() throws Exception {
        AtomicInteger sessionCalls = new AtomicInteger();
        AtomicInteger moduleCalls = new AtomicInteger();
        FixtureStore store = storeOf(
                counting("shared", Scope.SESSION, sessionCalls),
                counting("perModule", Scope.MODULE, moduleCalls));

        Object first = store.get("shared", FIRST_TEST);
        Object second = store.get("shared", OTHER_MODULE_TEST);
        Assert.assertSame(first, second);
        Assert.assertEquals(1, sessionCalls.get());

        store.get("perModule", FIRST_TEST);
        store.get("perModule", SECOND_TEST);
        store.get("perModule", OTHER_MODULE_TEST);
        Assert.assertEquals(2, moduleCalls.get());
    }

    @Test
    public void testTestScopedValueIsRebuiltAfterClose() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        FixtureStore store = storeOf(counting("perTest", Scope.TEST, calls));

        store.get("perTest", FIRST_TEST);
        store.get("perTest", FIRST_TEST);
        Assert.assertEquals(1, calls.get());

        store.closeScope(Scope.TEST, "m1#t1");
        store.get("perTest", FIRST_TEST);
        Assert.assertEquals(2, calls.get());
    }

    @Test
    public void testDependenciesAreBuiltFirstAndPassedIn() throws Exception {
        FixtureStore store = storeOf(
                definition("base", Scope.SESSION, context -> 20),
                definition("derived", Scope.TEST, context -> context.getValue("base", Integer.class) + 1, "base"));

        Assert.assertEquals(21, store.get("derived", FIRST_TEST));
        Assert.assertNotNull(store.getScopeInstance(Scope.SESSION, ScopePath.SESSION_KEY));
    }

    @Test
    public void testUndeclaredDependencyIsNotVisible() throws Exception {
        FixtureStore store = storeOf(
                definition("base", Scope.SESSION, context -> 1),
                definition("sneaky", Scope.TEST, context -> context.getValue("base")));

        FixtureSetupException e = AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("sneaky", FIRST_TEST));
        Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
    }

    @Test
    public void testTeardownsRunInReverseConstructionOrder() throws Exception {
        List<String> events = new ArrayList<>();
        FixtureStore store = storeOf(
                tracking("a", Scope.MODULE, events),
                tracking("b", Scope.MODULE, events, "a"),
                tracking("c", Scope.MODULE, events, "b"));

        store.get("c", FIRST_TEST);
        Assert.assertEquals(3, store.getScopeInstance(Scope.MODULE, "m1").getNumPendingTeardowns());
        List<FixtureTeardownException> failures = store.closeScope(Scope.MODULE, "m1");

        assertThat(failures, empty());
        assertThat(events, contains("setup a", "setup b", "setup c", "teardown c", "teardown b", "teardown a"));
        Assert.assertNull(store.getScopeInstance(Scope.MODULE, "m1"));
    }

    @Test
    public void testEverySuccessfulConstructionIsTornDownOnce() throws Exception {
        AtomicInteger teardowns = new AtomicInteger();
        FixtureStore store = storeOf(
                counted("a", teardowns),
                counted("b", teardowns, "a"),
                definition("broken", Scope.MODULE, context -> {
                    throw new IllegalStateException("setup boom");
                }, "a"));

        store.get("b", FIRST_TEST);
        store.get("b", SECOND_TEST);
        AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("broken", FIRST_TEST));

        ScopeInstance instance = store.getScopeInstance(Scope.MODULE, "m1");
        assertThat(instance.getCachedFixtureNames(), contains("a", "b"));
        int constructions = instance.getNumConstructions();
        Assert.assertEquals(2, constructions);

        store.closeScope(Scope.MODULE, "m1");
        Assert.assertEquals(constructions, teardowns.get());
    }

    @Test
    public void testFailingTeardownDoesNotStopOthers() throws Exception {
        List<String> events = new ArrayList<>();
        FixtureStore store = storeOf(
                tracking("a", Scope.MODULE, events),
                definition("broken", Scope.MODULE, context -> {
                    context.addTeardown(() -> {
                        throw new IllegalStateException("teardown boom");
                    });
                    return "broken";
                }, "a"));

        store.get("broken", FIRST_TEST);
        List<FixtureTeardownException> failures = store.closeScope(Scope.MODULE, "m1");

        Assert.assertEquals(1, failures.size());
        Assert.assertEquals("broken", failures.get(0).fixtureName);
        assertThat(events, contains("setup a", "teardown a"));
    }

    @Test
    public void testSetupFailureIsCachedForTheScopeInstance() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        FixtureStore store = storeOf(definition("broken", Scope.MODULE, context -> {
            calls.incrementAndGet();
            throw new IllegalStateException("setup boom");
        }));

        FixtureSetupException first = AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("broken", FIRST_TEST));
        AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("broken", SECOND_TEST));
        Assert.assertEquals("broken", first.fixtureName);
        Assert.assertEquals(1, calls.get());

        // A new module is a new instance and retries the factory.
        AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("broken", OTHER_MODULE_TEST));
        Assert.assertEquals(2, calls.get());
    }

    @Test
    public void testDependentOfFailedFixtureFailsWithoutRunning() throws Exception {
        AtomicInteger dependentCalls = new AtomicInteger();
        FixtureStore store = storeOf(
                definition("broken", Scope.SESSION, context -> {
                    throw new IllegalStateException("setup boom");
                }),
                counting("dependent", Scope.TEST, dependentCalls, "broken"));

        FixtureSetupException e = AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("dependent", FIRST_TEST));
        Assert.assertEquals("broken", e.fixtureName);
        Assert.assertEquals(0, dependentCalls.get());
    }

    @Test
    public void testTeardownAddedBeforeFactoryFailureStillRuns() throws Exception {
        List<String> events = new ArrayList<>();
        FixtureStore store = storeOf(definition("partial", Scope.TEST, context -> {
            context.addTeardown(() -> events.add("released"));
            throw new IllegalStateException("failed half way");
        }));

        AssertHelper.assertThrows(FixtureSetupException.class, () -> store.get("partial", FIRST_TEST));
        Assert.assertTrue(events.isEmpty());

        store.closeScope(Scope.TEST, "m1#t1");
        assertThat(events, contains("released"));
    }

    @Test
    public void testCustomScopeDefaultsToModuleKey() throws Exception {
        Scope group = Scope.custom("group", 50);
        AtomicInteger calls = new AtomicInteger();
        FixtureStore store = storeOf(counting("perGroup", group, calls));

        store.get("perGroup", FIRST_TEST);
        store.get("perGroup", SECOND_TEST);
        Assert.assertEquals(1, calls.get());

        store.get("perGroup", ScopePath.of("m1#t3", "m1", Collections.singletonMap("group", "other")));
        Assert.assertEquals(2, calls.get());
        Assert.assertNotNull(store.getScopeInstance(group, "m1/other"));
    }

    @Test
    public void testOpenScopesAreListedNarrowestFirst() throws Exception {
        FixtureStore store = storeOf(
                definition("shared", Scope.SESSION, context -> 1),
                definition("perModule", Scope.MODULE, context -> 2),
                definition("perTest", Scope.TEST, context -> 3));

        store.get("shared", FIRST_TEST);
        store.get("perModule", FIRST_TEST);
        store.get("perTest", FIRST_TEST);

        List<ScopeKey> keys = store.getOpenScopeKeys();
        Assert.assertEquals(3, keys.size());
        Assert.assertEquals(Scope.TEST, keys.get(0).scope);
        Assert.assertEquals(Scope.MODULE, keys.get(1).scope);
        Assert.assertEquals(Scope.SESSION, keys.get(2).scope);
    }

    @Test
    public void testClosingUnknownScopeDoesNothing() throws Exception {
        FixtureStore store = storeOf();
        assertThat(store.closeScope(Scope.MODULE, "never-opened"), empty());
    }

    @Test
    public void testUnvalidatedGraphIsRejected() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> FixtureStore.forGraph(new FixtureGraph()));
    }

    @Test
    public void testConcurrentRequestsConstructOnce() throws Exception {
        int numThreads = 8;
        AtomicInteger calls = new AtomicInteger();
        FixtureStore store = storeOf(definition("slow", Scope.SESSION, context -> {
            calls.incrementAndGet();
            Thread.sleep(50);
            return new Object();
        }));

        CyclicBarrier barrier = new CyclicBarrier(numThreads);
        CountDownLatch done = new CountDownLatch(numThreads);
        List<Object> values = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < numThreads; i++) {
            ScopePath path = ScopePath.of("m" + i + "#t", "m" + i);
            new Thread(() -> {
                try {
                    barrier.await();
                    values.add(store.get("slow", path));
                } catch (Exception e) {
                    values.add(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }
        done.await();

        Assert.assertEquals(1, calls.get());
        Assert.assertEquals(numThreads, values.size());
        for (Object value : values) {
            Assert.assertSame(values.get(0), value);
        }
    }

    private static FixtureStore storeOf(FixtureDefinition... definitions) throws FixtureGraphException {
        FixtureGraph graph = new FixtureGraph();
        for (FixtureDefinition definition : definitions) {
            graph.register(definition);
        }
        graph.validate();
        return FixtureStore.forGraph(graph);
    }

    private static FixtureDefinition definition(String name, Scope scope, FixtureFactory factory, String... dependencies) {
        return FixtureDefinition.Builder.newBuilder()
                .name(name)
                .scope(scope)
                .dependsOn(dependencies)
                .factory(factory)
                .build();
    }

    private static FixtureDefinition counting(String name, Scope scope, AtomicInteger calls, String... dependencies) {
        return definition(name, scope, context -> {
            calls.incrementAndGet();
            return new Object();
        }, dependencies);
    }

    private static FixtureDefinition counted(String name, AtomicInteger teardowns, String... dependencies) {
        return definition(name, Scope.MODULE, context -> {
            context.addTeardown(teardowns::incrementAndGet);
            return name;
        }, dependencies);
    }

    private static FixtureDefinition tracking(String name, Scope scope, List<String> events, String... dependencies) {
        return definition(name, scope, context -> {
            events.add("setup " + name);
            context.addTeardown(() -> events.add("teardown " + name));
            return name;
        }, dependencies);
    }
}
