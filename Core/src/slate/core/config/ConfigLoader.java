package slate.core.config;

import slate.core.exception.ParseException;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

/**
 * Assembles a {@link SessionConfig} from its sources, lowest precedence first: the defaults, the JSON file named by the
 * {@code slate.config} property, then the individual {@code slate.*} properties.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.forClass(ConfigLoader.class);
    public static final String CONFIG_FILE_PROPERTY = "slate.config";
    public static final String WORKERS_PROPERTY = "slate.workers";
    public static final String STOP_ON_FAILURE_PROPERTY = "slate.stop_on_failure";
    public static final String CAPTURE_OUTPUT_PROPERTY = "slate.capture_output";
    public static final String ENABLE_LOGGER_PROPERTY = "slate.enable_logger";
    private final JsonConfigParser parser = new JsonConfigParser();

    /**
     * Loads the configuration described by the given properties (typically {@link System#getProperties()}).
     *
     * @param properties The properties to read.
     * @return the configuration.
     * @throws ParseException If the config file or a property value is malformed.
     * @throws IOException If the config file cannot be read.
     */
    public SessionConfig load(Properties properties) throws ParseException, IOException {
        ObjectChecker.assertNonNull(properties);
        SessionConfig config = SessionConfig.defaults();

        String configPath = properties.getProperty(CONFIG_FILE_PROPERTY);
        if (configPath != null) {
            config = loadFile(new File(configPath), config);
        }
        return applyProperties(properties, config);
    }

    /**
     * Parses the given JSON config file over the base configuration.
     */
    public SessionConfig loadFile(File file, SessionConfig base) throws ParseException, IOException {
        ObjectChecker.assertNonNull(file, base);
        if (!file.isFile()) {
            throw new FileNotFoundException("Config file does not exist: " + file.getPath());
        }
        LOGGER.log("Loading config file: " + file.getPath());
        String json = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return this.parser.parse(json, base);
    }

    private static SessionConfig applyProperties(Properties properties, SessionConfig base) throws ParseException {
        SessionConfig.Builder builder = SessionConfig.Builder.from(base);

        String workers = properties.getProperty(WORKERS_PROPERTY);
        if (workers != null) {
            try {
                int numWorkers = Integer.parseInt(workers.trim());
                if (numWorkers < 1) {
                    throw new ParseException(WORKERS_PROPERTY + " must be strictly positive but was: " + workers);
                }
                builder.setNumberOfWorkers(numWorkers);
            } catch (NumberFormatException e) {
                throw new ParseException(WORKERS_PROPERTY + " is not an integer: " + workers);
            }
        }

        String stopOnFailure = properties.getProperty(STOP_ON_FAILURE_PROPERTY);
        if (stopOnFailure != null) {
            builder.setWhetherToStopOnFailure(parseBoolean(STOP_ON_FAILURE_PROPERTY, stopOnFailure));
        }
        String captureOutput = properties.getProperty(CAPTURE_OUTPUT_PROPERTY);
        if (captureOutput != null) {
            builder.setWhetherToCaptureOutput(parseBoolean(CAPTURE_OUTPUT_PROPERTY, captureOutput));
        }
        String enableLogger = properties.getProperty(ENABLE_LOGGER_PROPERTY);
        if (enableLogger != null) {
            builder.setWhetherToEnableLogger(parseBoolean(ENABLE_LOGGER_PROPERTY, enableLogger));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String property, String value) throws ParseException {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        } else if (trimmed.equalsIgnoreCase("false")) {
            return false;
        } else {
            throw new ParseException(property + " must be true or false but was: " + value);
        }
    }
}
