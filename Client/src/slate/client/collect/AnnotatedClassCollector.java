package slate.client.collect;

import slate.client.annotation.Fixture;
import slate.client.annotation.SlateTest;
import slate.client.annotation.Skip;
import slate.client.annotation.Use;
import slate.core.collect.Collector;
import slate.core.collect.TestCase;
import slate.core.exception.CollectionException;
import slate.core.exception.FixtureGraphException;
import slate.core.fixture.FixtureContext;
import slate.core.fixture.FixtureDefinition;
import slate.core.fixture.FixtureGraph;
import slate.core.fixture.FixtureValues;
import slate.core.fixture.Scope;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the {@link SlateTest} methods and {@link Fixture} factories declared by a list of classes.
 *
 * Classes are collected in the given order and the methods of each class in name order. A test's id is
 * {@code <class name>#<method name>} and its module is its class, so module-scoped fixtures live for the tests of one
 * class. Fixtures from all classes share one namespace.
 */
public final class AnnotatedClassCollector implements Collector {
    private static final Logger LOGGER = Logger.forClass(AnnotatedClassCollector.class);
    private final List<Class<?>> testClasses;
    private final Map<String, Scope> customScopes = new HashMap<>();

    private AnnotatedClassCollector(List<Class<?>> testClasses) {
        ObjectChecker.assertNonNull(testClasses);
        ObjectChecker.assertNoNullElements(testClasses);
        this.testClasses = new ArrayList<>(testClasses);
    }

    public static AnnotatedClassCollector forClasses(Class<?>... testClasses) {
        return new AnnotatedClassCollector(Arrays.asList(testClasses));
    }

    public static AnnotatedClassCollector forClasses(List<Class<?>> testClasses) {
        return new AnnotatedClassCollector(testClasses);
    }

    @Override
    public List<TestCase> collect(FixtureGraph fixtures) throws CollectionException, FixtureGraphException {
        ObjectChecker.assertNonNull(fixtures);

        List<TestCase> tests = new ArrayList<>();
        for (Class<?> testClass : this.testClasses) {
            for (Method method : sortedMethods(testClass)) {
                if (method.getAnnotation(Fixture.class) != null) {
                    FixtureDefinition definition = toFixtureDefinition(testClass, method);
                    LOGGER.log("Declared fixture: " + definition);
                    fixtures.register(definition);
                }
            }
            for (Method method : sortedMethods(testClass)) {
                if (method.getAnnotation(SlateTest.class) != null) {
                    TestCase test = toTestCase(testClass, method);
                    LOGGER.log("Declared test: " + test);
                    tests.add(test);
                }
            }
        }
        return tests;
    }

    private FixtureDefinition toFixtureDefinition(Class<?> testClass, Method method) throws CollectionException {
        Fixture fixture = method.getAnnotation(Fixture.class);
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new CollectionException("Fixture method must be static: " + describe(testClass, method));
        }
        if (method.getAnnotation(SlateTest.class) != null) {
            throw new CollectionException("Method cannot be both a test and a fixture: " + describe(testClass, method));
        }

        String name = fixture.value().isEmpty() ? method.getName() : fixture.value();
        method.setAccessible(true);
        return FixtureDefinition.Builder.newBuilder()
                .name(name)
                .scope(toScope(fixture, testClass, method))
                .dependsOn(usedFixtures(testClass, method, true))
                .factory(context -> createFixture(method, context))
                .build();
    }

    private TestCase toTestCase(Class<?> testClass, Method method) throws CollectionException {
        if (!Modifier.isStatic(method.getModifiers()) && (Modifier.isAbstract(testClass.getModifiers()) || testClass.isInterface())) {
            throw new CollectionException("Test class cannot be instantiated: " + describe(testClass, method));
        }

        List<String> required = usedFixtures(testClass, method, false);
        method.setAccessible(true);
        TestCase.Builder builder = TestCase.Builder.newBuilder()
                .id(testClass.getName() + "#" + method.getName())
                .module(testClass.getName())
                .requires(required)
                .body(values -> runTest(testClass, method, required, values));

        Skip skip = (method.getAnnotation(Skip.class) != null) ? method.getAnnotation(Skip.class) : testClass.getAnnotation(Skip.class);
        if (skip != null) {
            builder.skip(skip.value());
        }
        return builder.build();
    }

    private Scope toScope(Fixture fixture, Class<?> testClass, Method method) throws CollectionException {
        Scope builtIn = Scope.fromBuiltInName(fixture.scope());
        if (builtIn != null) {
            return builtIn;
        }

        Scope declared = this.customScopes.get(fixture.scope());
        if (declared == null) {
            try {
                declared = Scope.custom(fixture.scope(), fixture.level());
            } catch (IllegalArgumentException e) {
                throw new CollectionException("Invalid scope of fixture " + describe(testClass, method) + ": " + e.getMessage(), e);
            }
            this.customScopes.put(declared.name, declared);
        } else if ((fixture.level() != -1) && (fixture.level() != declared.level)) {
            throw new CollectionException("Scope '" + declared.name + "' is declared with levels " + declared.level + " and " + fixture.level() + " by " + describe(testClass, method));
        }
        return declared;
    }

    /**
     * Returns the fixture names of the method's {@link Use} parameters. Only fixture methods may also take the
     * {@link FixtureContext}.
     */
    private static List<String> usedFixtures(Class<?> testClass, Method method, boolean allowContext) throws CollectionException {
        List<String> names = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            Use use = parameter.getAnnotation(Use.class);
            if (use != null) {
                if (names.contains(use.value())) {
                    throw new CollectionException("Fixture '" + use.value() + "' is used twice by " + describe(testClass, method));
                }
                names.add(use.value());
            } else if (!(allowContext && (parameter.getType() == FixtureContext.class))) {
                throw new CollectionException("Parameter " + parameter.getName() + " of " + describe(testClass, method) + " is not annotated with @" + Use.class.getSimpleName());
            }
        }
        return names;
    }

    private static Object createFixture(Method method, FixtureContext context) throws Exception {
        Parameter[] parameters = method.getParameters();
        Object[] arguments = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            Use use = parameters[i].getAnnotation(Use.class);
            arguments[i] = (use == null) ? context : context.getValue(use.value());
        }

        Object value = invoke(method, null, arguments);
        if (value instanceof AutoCloseable) {
            context.addTeardown(((AutoCloseable) value)::close);
        }
        return value;
    }

    private static void runTest(Class<?> testClass, Method method, List<String> required, FixtureValues values) throws Exception {
        Object instance = null;
        if (!Modifier.isStatic(method.getModifiers())) {
            try {
                instance = testClass.getDeclaredConstructor().newInstance();
            } catch (InvocationTargetException e) {
                throw unwrap(e);
            }
        }

        Object[] arguments = new Object[required.size()];
        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = values.get(required.get(i));
        }
        invoke(method, instance, arguments);
    }

    private static Object invoke(Method method, Object instance, Object[] arguments) throws Exception {
        try {
            return method.invoke(instance, arguments);
        } catch (InvocationTargetException e) {
            throw unwrap(e);
        }
    }

    /**
     * Rethrows the error raised by the invoked method itself, so an assertion error in a test body stays one.
     */
    private static Exception unwrap(InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        } else if (cause instanceof Exception) {
            return (Exception) cause;
        } else {
            return e;
        }
    }

    private static List<Method> sortedMethods(Class<?> testClass) {
        List<Method> methods = new ArrayList<>(Arrays.asList(testClass.getDeclaredMethods()));
        methods.sort(Comparator.comparing(Method::getName));
        return methods;
    }

    private static String describe(Class<?> testClass, Method method) {
        return testClass.getName() + "#" + method.getName();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { classes: " + this.testClasses.size() + " }";
    }
}
