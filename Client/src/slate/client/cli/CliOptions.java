package slate.client.cli;

import slate.client.collect.TestClassFinder;
import slate.core.config.SessionConfig;
import slate.core.exception.ParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parsed command line: {@code slate [options] <target>...}.
 *
 * Options that are not given are left null so that they do not override the configuration file or the system properties.
 */
public final class CliOptions {
    public final List<String> targets;
    public final List<String> classpath;
    public final String matcher;
    public final String configPath;
    public final Integer numWorkers;
    public final Boolean stopOnFailure;
    public final Boolean captureOutput;
    public final Boolean enableLogger;
    public final List<String> pluginClassNames;

    private CliOptions(List<String> targets, List<String> classpath, String matcher, String configPath, Integer numWorkers, Boolean stopOnFailure, Boolean captureOutput, Boolean enableLogger, List<String> pluginClassNames) {
        this.targets = Collections.unmodifiableList(targets);
        this.classpath = Collections.unmodifiableList(classpath);
        this.matcher = matcher;
        this.configPath = configPath;
        this.numWorkers = numWorkers;
        this.stopOnFailure = stopOnFailure;
        this.captureOutput = captureOutput;
        this.enableLogger = enableLogger;
        this.pluginClassNames = Collections.unmodifiableList(pluginClassNames);
    }

    /**
     * Parses the given arguments.
     *
     * @param args The command line arguments.
     * @return the options.
     * @throws ParseException If an option is unknown or malformed or no target is given.
     */
    public static CliOptions parse(String[] args) throws ParseException {
        if (args == null) {
            throw new ParseException("Null arguments given.");
        }

        List<String> targets = new ArrayList<>();
        List<String> classpath = new ArrayList<>();
        List<String> plugins = new ArrayList<>();
        String matcher = TestClassFinder.DEFAULT_MATCHER;
        String configPath = null;
        Integer numWorkers = null;
        Boolean stopOnFailure = null;
        Boolean captureOutput = null;
        Boolean enableLogger = null;

        int index = 0;
        while (index < args.length) {
            String arg = args[index];
            switch (arg) {
                case "--workers":
                    String value = valueOf(args, index);
                    try {
                        numWorkers = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new ParseException("--workers is not an integer: " + value);
                    }
                    if (numWorkers < 1) {
                        throw new ParseException("--workers must be strictly positive but was: " + numWorkers);
                    }
                    index++;
                    break;
                case "--stop-on-failure":
                    stopOnFailure = true;
                    break;
                case "--no-capture":
                    captureOutput = false;
                    break;
                case "--verbose":
                    enableLogger = true;
                    break;
                case "--config":
                    configPath = valueOf(args, index);
                    index++;
                    break;
                case "--plugin":
                    plugins.add(valueOf(args, index));
                    index++;
                    break;
                case "--matcher":
                    matcher = valueOf(args, index);
                    index++;
                    break;
                case "--classpath":
                    classpath.add(valueOf(args, index));
                    index++;
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new ParseException("Unknown option: " + arg);
                    }
                    targets.add(arg);
            }
            index++;
        }

        if (targets.isEmpty()) {
            throw new ParseException("No test targets given.");
        }
        return new CliOptions(targets, classpath, matcher, configPath, numWorkers, stopOnFailure, captureOutput, enableLogger, plugins);
    }

    /**
     * Applies the options given on the command line over the base configuration.
     */
    public SessionConfig applyTo(SessionConfig base) {
        SessionConfig.Builder builder = SessionConfig.Builder.from(base);
        if (this.numWorkers != null) {
            builder.setNumberOfWorkers(this.numWorkers);
        }
        if (this.stopOnFailure != null) {
            builder.setWhetherToStopOnFailure(this.stopOnFailure);
        }
        if (this.captureOutput != null) {
            builder.setWhetherToCaptureOutput(this.captureOutput);
        }
        if (this.enableLogger != null) {
            builder.setWhetherToEnableLogger(this.enableLogger);
        }
        for (String pluginClassName : this.pluginClassNames) {
            builder.addPluginClassName(pluginClassName);
        }
        return builder.build();
    }

    public static String usage() {
        return "slate [options] <target>..."
                + "\n\ttarget: a directory of compiled test classes or the binary name of a test class."
                + "\n\t--workers N: run the tests on N parallel workers, partitioned by test class."
                + "\n\t--stop-on-failure: skip the remaining tests after the first failure."
                + "\n\t--no-capture: do not capture the output of tests."
                + "\n\t--verbose: enable the internal logger."
                + "\n\t--config FILE: read the JSON configuration file."
                + "\n\t--plugin CLASS: activate the plugin class. May be repeated."
                + "\n\t--matcher REGEX: the class file names to collect from directories. Default: " + TestClassFinder.DEFAULT_MATCHER
                + "\n\t--classpath PATH: a jar or class directory the tests depend on. May be repeated.";
    }

    private static String valueOf(String[] args, int index) throws ParseException {
        if (index + 1 >= args.length) {
            throw new ParseException(args[index] + " requires a value.");
        }
        return args[index + 1];
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { targets: " + this.targets + ", workers: " + this.numWorkers + ", plugins: " + this.pluginClassNames + " }";
    }
}
