package slate.client.cli;

import slate.client.collect.AnnotatedClassCollector;
import slate.client.collect.TestClassFinder;
import slate.client.output.ConsoleReporter;
import slate.core.config.ConfigLoader;
import slate.core.config.SessionConfig;
import slate.core.exception.CollectionException;
import slate.core.exception.FixtureGraphException;
import slate.core.exception.ParseException;
import slate.core.hook.HookDispatcher;
import slate.core.hook.Plugin;
import slate.core.result.ExitStatus;
import slate.core.result.SessionSummary;
import slate.core.session.SessionRunner;
import slate.core.util.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Properties;

/**
 * The command line entry point. Collects the annotated tests of the given targets, runs them in one session and exits
 * with the session's {@link ExitStatus}.
 *
 * Configuration is read, lowest precedence first, from the defaults, the JSON file named by {@code --config} or the
 * {@code slate.config} property, the {@code slate.*} system properties and finally the command line options.
 */
public final class SlateCli {
    private static final Logger LOGGER = Logger.forClass(SlateCli.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System.getProperties(), true));
    }

    /**
     * Runs a session for the given command line and returns the process exit code.
     *
     * @param args The command line arguments.
     * @param out The stream results are reported to.
     * @param err The stream errors are reported to.
     * @param properties The properties to read configuration from.
     * @return the exit code.
     */
    public static int run(String[] args, PrintStream out, PrintStream err, Properties properties) {
        return run(args, out, err, properties, false);
    }

    private static int run(String[] args, PrintStream out, PrintStream err, Properties properties, boolean abortOnShutdown) {
        CliOptions options;
        SessionConfig config;
        try {
            options = CliOptions.parse(args);
            config = options.applyTo(loadConfig(options, properties));
        } catch (ParseException | IOException e) {
            err.println("Invalid configuration: " + e.getMessage());
            err.println(CliOptions.usage());
            return ExitStatus.COLLECTION_OR_CONFIGURATION_ERROR.code;
        }

        if (config.enableLogger) {
            Logger.globalEnable();
        } else {
            Logger.globalDisable();
        }
        LOGGER.log("Running with " + options + " and " + config);

        TestClassFinder finder;
        try {
            finder = TestClassFinder.forTargets(options.targets, options.classpath, options.matcher, SlateCli.class.getClassLoader());
        } catch (CollectionException e) {
            err.println("Collection failed: " + e.getMessage());
            return ExitStatus.COLLECTION_OR_CONFIGURATION_ERROR.code;
        }

        try {
            SessionRunner runner;
            try {
                List<Class<?>> testClasses = finder.findClasses();
                HookDispatcher dispatcher = new HookDispatcher();
                for (String pluginClassName : config.pluginClassNames) {
                    dispatcher.activate(loadPlugin(pluginClassName, finder.getClassLoader()));
                }

                runner = SessionRunner.Builder.newBuilder()
                        .config(config)
                        .collector(AnnotatedClassCollector.forClasses(testClasses))
                        .hooks(dispatcher)
                        .addListener(ConsoleReporter.toStreams(out, err))
                        .build();
            } catch (CollectionException | ParseException e) {
                err.println("Collection failed: " + e.getMessage());
                return ExitStatus.COLLECTION_OR_CONFIGURATION_ERROR.code;
            }

            if (!abortOnShutdown) {
                return execute(runner, err, null);
            }

            SignalAbortHook hook = new SignalAbortHook(runner, SHUTDOWN_GRACE_SECONDS, code -> Runtime.getRuntime().halt(code));
            Thread hookThread = new Thread(hook, "SlateShutdownHook");
            Runtime.getRuntime().addShutdownHook(hookThread);
            try {
                return execute(runner, err, hook);
            } finally {
                removeShutdownHook(hookThread);
            }
        } finally {
            closeFinder(finder);
        }
    }

    /**
     * Runs the session and hands its exit code to the shutdown hook, if any, which may be waiting to exit with it.
     */
    static int execute(SessionRunner runner, PrintStream err, SignalAbortHook hook) {
        int code = runSession(runner, err);
        if (hook != null) {
            hook.sessionFinished(code);
        }
        return code;
    }

    private static int runSession(SessionRunner runner, PrintStream err) {
        try {
            SessionSummary summary = runner.run();
            return summary.getExitStatus().code;
        } catch (CollectionException | FixtureGraphException e) {
            err.println("Collection failed: " + e.getMessage());
            return ExitStatus.COLLECTION_OR_CONFIGURATION_ERROR.code;
        } catch (Throwable t) {
            err.println("Encountered an unexpected error.");
            t.printStackTrace(err);
            return ExitStatus.INTERNAL_ERROR.code;
        }
    }

    private static SessionConfig loadConfig(CliOptions options, Properties properties) throws ParseException, IOException {
        Properties effective = new Properties();
        effective.putAll(properties);
        if (options.configPath != null) {
            effective.setProperty(ConfigLoader.CONFIG_FILE_PROPERTY, options.configPath);
        }
        return new ConfigLoader().load(effective);
    }

    private static Plugin loadPlugin(String className, ClassLoader classLoader) throws ParseException {
        try {
            Class<?> pluginClass = Class.forName(className, true, classLoader);
            if (!Plugin.class.isAssignableFrom(pluginClass)) {
                throw new ParseException("Plugin class does not implement " + Plugin.class.getName() + ": " + className);
            }
            return (Plugin) pluginClass.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ParseException("Plugin class not found: " + className + " (" + e + ")");
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new ParseException("Plugin class cannot be instantiated: " + className + " (" + e + ")");
        }
    }

    private static void closeFinder(TestClassFinder finder) {
        try {
            finder.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close the test class loader.", e);
        }
    }

    private static void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            LOGGER.log("Shutdown already in progress, leaving the shutdown hook in place.");
        }
    }
}
