package slate.core.session;

import org.junit.Assert;
import org.junit.Test;
import slate.core.collect.TestBody;
import slate.core.collect.TestCase;
import slate.core.config.SessionConfig;
import slate.core.exception.CollectionException;
import slate.core.exception.CyclicDependencyException;
import slate.core.exception.FixtureGraphException;
import slate.core.exception.SkipTestException;
import slate.core.exception.UnknownFixtureException;
import slate.core.fixture.FixtureDefinition;
import slate.core.fixture.FixtureFactory;
import slate.core.fixture.Scope;
import slate.core.helper.AssertHelper;
import slate.core.hook.HookDispatcher;
import slate.core.hook.HookPoint;
import slate.core.result.ErrorOrigin;
import slate.core.result.ExitStatus;
import slate.core.result.Outcome;
import slate.core.result.Result;
import slate.core.result.ResultListener;
import slate.core.result.SessionSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;

public class SessionRunnerTest {

    @Test
    public void testSessionFixtureIsBuiltOnceAndTornDownAfterLastTest() throws Exception {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger factoryCalls = new AtomicInteger();
        ListCollector collector = new ListCollector()
                .fixture(definition("F", Scope.SESSION, context -> {
                    factoryCalls.incrementAndGet();
                    context.addTeardown(() -> events.add("teardown F"));
                    return "F";
                }))
                .test(test("t1", "m", fixtures -> events.add("t1"), "F"))
                .test(test("t2", "m", fixtures -> events.add("t2"), "F"))
                .test(test("t3", "m", fixtures -> events.add("t3"), "F"));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener).run();

        Assert.assertEquals(1, factoryCalls.get());
        assertThat(events, contains("t1", "t2", "t3", "teardown F"));
        Assert.assertEquals(3, summary.getCount(Outcome.PASSED));
        Assert.assertEquals(ExitStatus.SUCCESS, summary.getExitStatus());
        Assert.assertSame(summary, listener.summary);
    }

    @Test
    public void testSetupFailureSkipsBodyAndOnlyFailsThatTest() throws Exception {
        AtomicInteger bodyCalls = new AtomicInteger();
        ListCollector collector = new ListCollector()
                .fixture(definition("broken", Scope.TEST, context -> {
                    throw new IllegalStateException("cannot connect");
                }))
                .test(test("needsBroken", "m", fixtures -> bodyCalls.incrementAndGet(), "broken"))
                .test(test("independent", "m", fixtures -> { }));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener).run();

        Assert.assertEquals(0, bodyCalls.get());
        Result failed = listener.testResult("needsBroken");
        Assert.assertEquals(Outcome.ERROR, failed.outcome);
        Assert.assertEquals(ErrorOrigin.FIXTURE_SETUP, failed.failure.origin);
        assertThat(failed.failure.message, containsString("cannot connect"));
        Assert.assertEquals(Outcome.PASSED, listener.testResult("independent").outcome);
        Assert.assertEquals(ExitStatus.TESTS_FAILED, summary.getExitStatus());
    }

    @Test
    public void testAssertionFailsAndExceptionErrors() throws Exception {
        ListCollector collector = new ListCollector()
                .test(test("asserts", "m", fixtures -> Assert.fail("expected")))
                .test(test("throws", "m", fixtures -> {
                    throw new IllegalArgumentException("unexpected");
                }));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener).run();

        Assert.assertEquals(Outcome.FAILED, listener.testResult("asserts").outcome);
        Assert.assertEquals(Outcome.ERROR, listener.testResult("throws").outcome);
        Assert.assertEquals(ErrorOrigin.TEST_BODY, listener.testResult("throws").failure.origin);
        Assert.assertEquals(1, summary.getCount(Outcome.FAILED));
        Assert.assertEquals(1, summary.getCount(Outcome.ERROR));
    }

    @Test
    public void testHookFailureIsIsolated() throws Exception {
        List<String> calls = new ArrayList<>();
        HookDispatcher dispatcher = new HookDispatcher();
        dispatcher.register(HookPoint.BEFORE_TEST, "broken", context -> {
            throw new IllegalStateException("plugin bug");
        });
        dispatcher.register(HookPoint.BEFORE_TEST, "healthy", context -> calls.add(context.test.id));
        ListCollector collector = new ListCollector()
                .test(test("t1", "m", fixtures -> { }))
                .test(test("t2", "m", fixtures -> { }));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), dispatcher, listener).run();

        assertThat(calls, contains("t1", "t2"));
        Assert.assertEquals(2, summary.getCount(Outcome.PASSED));
        Assert.assertEquals(2, summary.numHookErrors);
        Result hookError = listener.results.get(0);
        Assert.assertEquals(Result.Kind.HOOK, hookError.kind);
        Assert.assertEquals("t1", hookError.testId);
        Assert.assertEquals(ErrorOrigin.HOOK, hookError.failure.origin);
    }

    @Test
    public void testAbortInterruptsRemainingTestsAndStillTearsDown() throws Exception {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<SessionRunner> runner = new AtomicReference<>();
        ListCollector collector = new ListCollector()
                .fixture(definition("F", Scope.MODULE, context -> {
                    context.addTeardown(() -> events.add("teardown F"));
                    return "F";
                }))
                .test(test("t1", "m", fixtures -> {
                    events.add("t1");
                    runner.get().abort("user request");
                }, "F"))
                .test(test("t2", "m", fixtures -> events.add("t2"), "F"))
                .test(test("t3", "m", fixtures -> events.add("t3"), "F"));

        RecordingListener listener = new RecordingListener();
        runner.set(runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener));
        SessionSummary summary = runner.get().run();

        assertThat(events, contains("t1", "teardown F"));
        Assert.assertEquals(Outcome.PASSED, listener.testResult("t1").outcome);
        Assert.assertEquals(Outcome.INTERRUPTED, listener.testResult("t2").outcome);
        Assert.assertEquals("user request", listener.testResult("t3").reason);
        Assert.assertTrue(summary.wasInterrupted);
        Assert.assertEquals(ExitStatus.INTERRUPTED, summary.getExitStatus());
        Assert.assertEquals(SessionPhase.CLOSED, runner.get().getPhase());
    }

    @Test
    public void testCycleFailsBeforeAnyTestRuns() throws Exception {
        AtomicInteger bodyCalls = new AtomicInteger();
        List<HookPoint> points = new ArrayList<>();
        HookDispatcher dispatcher = recordingDispatcher(points);
        ListCollector collector = new ListCollector()
                .fixture(definition("A", Scope.TEST, context -> "A", "B"))
                .fixture(definition("B", Scope.TEST, context -> "B", "A"))
                .test(test("t1", "m", fixtures -> bodyCalls.incrementAndGet()));

        RecordingListener listener = new RecordingListener();
        SessionRunner runner = runner(collector, SessionConfig.defaults(), dispatcher, listener);
        AssertHelper.assertThrows(CyclicDependencyException.class, runner::run);

        Assert.assertEquals(0, bodyCalls.get());
        Assert.assertTrue(listener.results.isEmpty());
        Assert.assertEquals(SessionPhase.CLOSED, runner.getPhase());
        assertThat(points, contains(HookPoint.SESSION_START, HookPoint.SESSION_END));
    }

    @Test
    public void testUnknownTestRequirementFailsBeforeAnyTestRuns() {
        ListCollector collector = new ListCollector().test(test("t1", "m", fixtures -> { }, "missing"));
        SessionRunner runner = runner(collector, SessionConfig.defaults(), new HookDispatcher(), new RecordingListener());

        UnknownFixtureException e = AssertHelper.assertThrows(UnknownFixtureException.class, runner::run);
        Assert.assertEquals("missing", e.fixtureName);
    }

    @Test
    public void testDuplicateTestIdIsACollectionError() {
        ListCollector collector = new ListCollector()
                .test(test("same", "m", fixtures -> { }))
                .test(test("same", "m", fixtures -> { }));
        SessionRunner runner = runner(collector, SessionConfig.defaults(), new HookDispatcher(), new RecordingListener());

        AssertHelper.assertThrows(CollectionException.class, runner::run);
    }

    @Test
    public void testCollectorFailureIsRethrown() {
        SessionRunner runner = SessionRunner.Builder.newBuilder()
                .collector(fixtures -> {
                    throw new CollectionException("bad target");
                })
                .build();

        CollectionException e = AssertHelper.assertThrows(CollectionException.class, runner::run);
        Assert.assertEquals("bad target", e.getMessage());
        Assert.assertEquals(SessionPhase.CLOSED, runner.getPhase());
    }

    @Test
    public void testCollectorRuntimeExceptionIsACollectionError() {
        List<HookPoint> points = new ArrayList<>();
        SessionRunner runner = SessionRunner.Builder.newBuilder()
                .collector(fixtures -> {
                    throw new IllegalArgumentException("bad annotation");
                })
                .hooks(recordingDispatcher(points))
                .build();

        CollectionException e = AssertHelper.assertThrows(CollectionException.class, runner::run);
        Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
        Assert.assertEquals(SessionPhase.CLOSED, runner.getPhase());
        assertThat(points, contains(HookPoint.SESSION_START, HookPoint.SESSION_END));
    }

    @Test
    public void testCollectorErrorIsACollectionError() {
        List<HookPoint> points = new ArrayList<>();
        SessionRunner runner = SessionRunner.Builder.newBuilder()
                .collector(fixtures -> {
                    throw new NoClassDefFoundError("com/example/Missing");
                })
                .hooks(recordingDispatcher(points))
                .build();

        CollectionException e = AssertHelper.assertThrows(CollectionException.class, runner::run);
        Assert.assertTrue(e.getCause() instanceof NoClassDefFoundError);
        Assert.assertEquals(SessionPhase.CLOSED, runner.getPhase());
        assertThat(points, contains(HookPoint.SESSION_START, HookPoint.SESSION_END));
    }

    @Test
    public void testModuleFixtureClosesAtModuleBoundary() throws Exception {
        List<String> events = new ArrayList<>();
        ListCollector collector = new ListCollector()
                .fixture(definition("M", Scope.MODULE, context -> {
                    events.add("setup M " + context.getScopeKey());
                    context.addTeardown(() -> events.add("teardown M " + context.getScopeKey()));
                    return "M";
                }))
                .test(test("a1", "a", fixtures -> events.add("a1"), "M"))
                .test(test("a2", "a", fixtures -> events.add("a2"), "M"))
                .test(test("b1", "b", fixtures -> events.add("b1"), "M"));

        runner(collector, SessionConfig.defaults(), new HookDispatcher(), new RecordingListener()).run();

        assertThat(events, contains("setup M a", "a1", "a2", "teardown M a", "setup M b", "b1", "teardown M b"));
    }

    @Test
    public void testCustomScopeClosesWhenItsKeyChanges() throws Exception {
        Scope group = Scope.custom("group", 50);
        List<String> events = new ArrayList<>();
        ListCollector collector = new ListCollector()
                .fixture(definition("G", group, context -> {
                    events.add("setup G " + context.getScopeKey());
                    context.addTeardown(() -> events.add("teardown G " + context.getScopeKey()));
                    return "G";
                }))
                .test(TestCase.Builder.newBuilder().id("t1").module("m").customScopeKey("group", "x").requires("G").body(fixtures -> events.add("t1")).build())
                .test(TestCase.Builder.newBuilder().id("t2").module("m").customScopeKey("group", "x").requires("G").body(fixtures -> events.add("t2")).build())
                .test(TestCase.Builder.newBuilder().id("t3").module("m").customScopeKey("group", "y").requires("G").body(fixtures -> events.add("t3")).build());

        runner(collector, SessionConfig.defaults(), new HookDispatcher(), new RecordingListener()).run();

        assertThat(events, contains("setup G m/x", "t1", "t2", "teardown G m/x", "setup G m/y", "t3", "teardown G m/y"));
    }

    @Test
    public void testSkipMarkerSkipsSetupAndBody() throws Exception {
        AtomicInteger factoryCalls = new AtomicInteger();
        List<Outcome> onError = new ArrayList<>();
        HookDispatcher dispatcher = new HookDispatcher();
        dispatcher.register(HookPoint.ON_ERROR, "recorder", context -> onError.add(context.result.outcome));
        ListCollector collector = new ListCollector()
                .fixture(definition("F", Scope.TEST, context -> factoryCalls.incrementAndGet()))
                .test(TestCase.Builder.newBuilder().id("skipped").requires("F").skip("not on this platform").body(fixtures -> Assert.fail()).build());

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), dispatcher, listener).run();

        Assert.assertEquals(0, factoryCalls.get());
        Assert.assertEquals(Outcome.SKIPPED, listener.testResult("skipped").outcome);
        Assert.assertEquals("not on this platform", listener.testResult("skipped").reason);
        assertThat(onError, contains(Outcome.SKIPPED));
        Assert.assertEquals(ExitStatus.SUCCESS, summary.getExitStatus());
    }

    @Test
    public void testSkipRequests() throws Exception {
        HookDispatcher dispatcher = new HookDispatcher();
        dispatcher.register(HookPoint.BEFORE_TEST, "skipper", context -> {
            if (context.test.id.equals("byHook")) {
                context.requestSkip("skipped by plugin");
            }
        });
        ListCollector collector = new ListCollector()
                .fixture(definition("unavailable", Scope.TEST, context -> {
                    throw new SkipTestException("no database");
                }))
                .test(test("byHook", "m", fixtures -> Assert.fail()))
                .test(test("byFixture", "m", fixtures -> Assert.fail(), "unavailable"))
                .test(test("byBody", "m", fixtures -> {
                    throw new SkipTestException("not today");
                }));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), dispatcher, listener).run();

        Assert.assertEquals("skipped by plugin", listener.testResult("byHook").reason);
        Assert.assertEquals("no database", listener.testResult("byFixture").reason);
        Assert.assertEquals("not today", listener.testResult("byBody").reason);
        Assert.assertEquals(3, summary.getCount(Outcome.SKIPPED));
    }

    @Test
    public void testStopOnFailureSkipsRemainingTests() throws Exception {
        AtomicInteger bodyCalls = new AtomicInteger();
        ListCollector collector = new ListCollector()
                .test(test("t1", "m", fixtures -> Assert.fail("first")))
                .test(test("t2", "m", fixtures -> bodyCalls.incrementAndGet()));

        RecordingListener listener = new RecordingListener();
        SessionConfig config = SessionConfig.Builder.newBuilder().setWhetherToStopOnFailure(true).build();
        SessionSummary summary = runner(collector, config, new HookDispatcher(), listener).run();

        Assert.assertEquals(0, bodyCalls.get());
        Assert.assertEquals(Outcome.SKIPPED, listener.testResult("t2").outcome);
        Assert.assertEquals(TestWorker.STOPPED_ON_FAILURE, listener.testResult("t2").reason);
        Assert.assertEquals(ExitStatus.TESTS_FAILED, summary.getExitStatus());
    }

    @Test
    public void testTeardownErrorIsRecordedSeparately() throws Exception {
        ListCollector collector = new ListCollector()
                .fixture(definition("F", Scope.TEST, context -> {
                    context.addTeardown(() -> {
                        throw new IllegalStateException("leak");
                    });
                    return "F";
                }))
                .test(test("t1", "m", fixtures -> { }, "F"))
                .test(test("t2", "m", fixtures -> { }));

        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener).run();

        Assert.assertEquals(Outcome.PASSED, listener.testResult("t1").outcome);
        Assert.assertEquals(Outcome.PASSED, listener.testResult("t2").outcome);
        Assert.assertEquals(1, summary.numTeardownErrors);
        Result teardownError = listener.results.get(1);
        Assert.assertEquals(Result.Kind.TEARDOWN, teardownError.kind);
        Assert.assertEquals("F", teardownError.subject);
        Assert.assertEquals("t1", teardownError.testId);
        Assert.assertEquals(ExitStatus.TESTS_FAILED, summary.getExitStatus());
    }

    @Test
    public void testOnErrorFiresAfterTeardownAndAfterTest() throws Exception {
        List<String> events = new ArrayList<>();
        HookDispatcher dispatcher = new HookDispatcher();
        dispatcher.register(HookPoint.AFTER_TEST, "after", context -> events.add("after_test " + context.result.outcome));
        dispatcher.register(HookPoint.ON_ERROR, "error", context -> events.add("on_error " + context.result.outcome));
        ListCollector collector = new ListCollector()
                .fixture(definition("F", Scope.TEST, context -> {
                    context.addTeardown(() -> events.add("teardown F"));
                    return "F";
                }))
                .test(test("t1", "m", fixtures -> {
                    throw new IllegalStateException("boom");
                }, "F"));

        runner(collector, SessionConfig.defaults(), dispatcher, new RecordingListener()).run();

        assertThat(events, contains("teardown F", "after_test ERROR", "on_error ERROR"));
    }

    @Test
    public void testOnErrorFiresForTeardownErrorRecords() throws Exception {
        List<String> events = new ArrayList<>();
        HookDispatcher dispatcher = new HookDispatcher();
        dispatcher.register(HookPoint.ON_ERROR, "error", context -> events.add(context.result.kind + " " + context.result.subject
                + " " + ((context.test == null) ? "-" : context.test.id)));
        ListCollector collector = new ListCollector()
                .fixture(definition("perTest", Scope.TEST, context -> {
                    context.addTeardown(() -> {
                        throw new IllegalStateException("test leak");
                    });
                    return "perTest";
                }))
                .fixture(definition("shared", Scope.SESSION, context -> {
                    context.addTeardown(() -> {
                        throw new IllegalStateException("session leak");
                    });
                    return "shared";
                }))
                .test(test("t1", "m", fixtures -> { }, "perTest", "shared"));

        SessionSummary summary = runner(collector, SessionConfig.defaults(), dispatcher, new RecordingListener()).run();

        assertThat(events, contains("TEARDOWN perTest t1", "TEARDOWN shared -"));
        Assert.assertEquals(2, summary.numTeardownErrors);
        Assert.assertEquals(0, summary.numHookErrors);
    }

    @Test
    public void testHookPointsFireInSessionOrder() throws Exception {
        List<HookPoint> points = new ArrayList<>();
        ListCollector collector = new ListCollector().test(test("t1", "m", fixtures -> { }));

        SessionRunner runner = runner(collector, SessionConfig.defaults(), recordingDispatcher(points), new RecordingListener());
        Assert.assertEquals(SessionPhase.IDLE, runner.getPhase());
        runner.run();

        assertThat(points, contains(HookPoint.SESSION_START, HookPoint.BEFORE_TEST, HookPoint.AFTER_TEST, HookPoint.BEFORE_SESSION_CLEANUP, HookPoint.SESSION_END));
        Assert.assertEquals(TestPhase.DONE, runner.getState().getTestPhase("t1"));
    }

    @Test
    public void testFixtureValuesAreInjectedIntoBody() throws Exception {
        AtomicReference<Object> seen = new AtomicReference<>();
        ListCollector collector = new ListCollector()
                .fixture(definition("base", Scope.SESSION, context -> 41))
                .fixture(definition("answer", Scope.TEST, context -> context.getValue("base", Integer.class) + 1, "base"))
                .test(test("t1", "m", fixtures -> seen.set(fixtures.get("answer")), "answer"));

        runner(collector, SessionConfig.defaults(), new HookDispatcher(), new RecordingListener()).run();

        Assert.assertEquals(42, seen.get());
    }

    @Test
    public void testOutputIsCapturedPerTest() throws Exception {
        ListCollector collector = new ListCollector()
                .test(test("noisy", "m", fixtures -> {
                    System.out.println("to stdout");
                    System.err.println("to stderr");
                }))
                .test(test("quiet", "m", fixtures -> { }));

        RecordingListener listener = new RecordingListener();
        runner(collector, SessionConfig.defaults(), new HookDispatcher(), listener).run();

        assertThat(listener.testResult("noisy").capturedStdout, containsString("to stdout"));
        assertThat(listener.testResult("noisy").capturedStderr, containsString("to stderr"));
        Assert.assertEquals("", listener.testResult("quiet").capturedStdout);
    }

    @Test
    public void testParallelSessionSharesSessionFixture() throws Exception {
        AtomicInteger sessionCalls = new AtomicInteger();
        AtomicInteger moduleCalls = new AtomicInteger();
        List<String> teardowns = Collections.synchronizedList(new ArrayList<>());
        ListCollector collector = new ListCollector()
                .fixture(definition("S", Scope.SESSION, context -> {
                    sessionCalls.incrementAndGet();
                    Thread.sleep(20);
                    context.addTeardown(() -> teardowns.add("S"));
                    return "S";
                }))
                .fixture(definition("M", Scope.MODULE, context -> {
                    moduleCalls.incrementAndGet();
                    context.addTeardown(() -> teardowns.add("M " + context.getScopeKey()));
                    return "M";
                }, "S"));
        for (int module = 0; module < 4; module++) {
            for (int i = 0; i < 3; i++) {
                collector.test(test("m" + module + "#t" + i, "m" + module, fixtures -> Assert.assertEquals("M", fixtures.get("M")), "M"));
            }
        }

        RecordingListener listener = new RecordingListener();
        SessionConfig config = SessionConfig.Builder.newBuilder().setNumberOfWorkers(3).build();
        SessionSummary summary = runner(collector, config, new HookDispatcher(), listener).run();

        Assert.assertEquals(12, summary.getCount(Outcome.PASSED));
        Assert.assertEquals(1, sessionCalls.get());
        Assert.assertEquals(4, moduleCalls.get());
        Assert.assertEquals(5, teardowns.size());
        Assert.assertEquals("S", teardowns.get(teardowns.size() - 1));
    }

    @Test
    public void testInterruptedParallelSessionWaitsForRunningTests() throws Exception {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch bodiesStarted = new CountDownLatch(2);
        CountDownLatch releaseBodies = new CountDownLatch(1);
        TestBody slowBody = fixtures -> {
            bodiesStarted.countDown();
            releaseBodies.await();
            events.add("body " + Thread.currentThread().getName());
        };
        ListCollector collector = new ListCollector()
                .fixture(definition("S", Scope.SESSION, context -> {
                    context.addTeardown(() -> events.add("teardown S"));
                    return "S";
                }))
                .test(test("m1#slow", "m1", slowBody, "S"))
                .test(test("m1#next", "m1", fixtures -> events.add("next"), "S"))
                .test(test("m2#slow", "m2", slowBody, "S"));

        RecordingListener listener = new RecordingListener();
        SessionConfig config = SessionConfig.Builder.newBuilder().setNumberOfWorkers(2).build();
        SessionRunner runner = runner(collector, config, new HookDispatcher(), listener);

        AtomicReference<SessionSummary> summary = new AtomicReference<>();
        AtomicReference<Boolean> flagRestored = new AtomicReference<>();
        Thread runnerThread = new Thread(() -> {
            try {
                summary.set(runner.run());
            } catch (Exception e) {
                throw new IllegalStateException(e);
            } finally {
                flagRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        runnerThread.start();

        bodiesStarted.await();
        runnerThread.interrupt();
        while (!runner.getState().getAbortMonitor().isAbortRequested()) {
            Thread.sleep(10);
        }
        releaseBodies.countDown();
        runnerThread.join();

        Assert.assertEquals(3, events.size());
        Assert.assertEquals("teardown S", events.get(2));
        Assert.assertFalse(events.contains("next"));
        Assert.assertEquals(Outcome.PASSED, listener.testResult("m1#slow").outcome);
        Assert.assertEquals(Outcome.PASSED, listener.testResult("m2#slow").outcome);
        Assert.assertEquals(Outcome.INTERRUPTED, listener.testResult("m1#next").outcome);
        Assert.assertEquals(SessionRunner.RUNNER_INTERRUPTED, listener.testResult("m1#next").reason);
        Assert.assertEquals(ExitStatus.INTERRUPTED, summary.get().getExitStatus());
        Assert.assertTrue(flagRestored.get());
    }

    @Test
    public void testEmptySessionSucceeds() throws Exception {
        RecordingListener listener = new RecordingListener();
        SessionSummary summary = runner(new ListCollector(), SessionConfig.defaults(), new HookDispatcher(), listener).run();

        Assert.assertEquals(0, summary.getTotalNumTests());
        Assert.assertEquals(ExitStatus.SUCCESS, summary.getExitStatus());
        Assert.assertSame(summary, listener.summary);
    }

    private static SessionRunner runner(ListCollector collector, SessionConfig config, HookDispatcher dispatcher, RecordingListener listener) {
        return SessionRunner.Builder.newBuilder()
                .config(config)
                .collector(collector)
                .hooks(dispatcher)
                .addListener(listener)
                .sessionId("test-session")
                .build();
    }

    private static HookDispatcher recordingDispatcher(List<HookPoint> points) {
        HookDispatcher dispatcher = new HookDispatcher();
        for (HookPoint point : HookPoint.values()) {
            dispatcher.register(point, "recorder", context -> points.add(context.point));
        }
        return dispatcher;
    }

    private static FixtureDefinition definition(String name, Scope scope, FixtureFactory factory, String... dependencies) {
        return FixtureDefinition.Builder.newBuilder()
                .name(name)
                .scope(scope)
                .dependsOn(dependencies)
                .factory(factory)
                .build();
    }

    private static TestCase test(String id, String module, TestBody body, String... fixtures) {
        return TestCase.Builder.newBuilder()
                .id(id)
                .module(module)
                .requires(fixtures)
                .body(body)
                .build();
    }

    private static final class ListCollector implements slate.core.collect.Collector {
        private final List<FixtureDefinition> fixtures = new ArrayList<>();
        private final List<TestCase> tests = new ArrayList<>();

        ListCollector fixture(FixtureDefinition definition) {
            this.fixtures.add(definition);
            return this;
        }

        ListCollector test(TestCase test) {
            this.tests.add(test);
            return this;
        }

        @Override
        public List<TestCase> collect(slate.core.fixture.FixtureGraph graph) throws FixtureGraphException {
            for (FixtureDefinition definition : this.fixtures) {
                graph.register(definition);
            }
            return this.tests;
        }
    }

    private static final class RecordingListener implements ResultListener {
        private final List<Result> results = Collections.synchronizedList(new ArrayList<>());
        private volatile SessionSummary summary = null;

        @Override
        public void onResult(Result result) {
            this.results.add(result);
        }

        @Override
        public void onSessionFinished(SessionSummary summary) {
            this.summary = summary;
        }

        Result testResult(String testId) {
            synchronized (this.results) {
                for (Result result : this.results) {
                    if (result.isTestResult() && result.testId.equals(testId)) {
                        return result;
                    }
                }
            }
            throw new AssertionError("No result for test " + testId);
        }
    }
}
