package slate.core.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import slate.core.exception.ParseException;
import slate.core.util.ObjectChecker;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parses a JSON configuration document on top of a base configuration. Only the keys present in the document override
 * the base settings:
 *
 * <pre>
 * {
 *     "workers": 4,
 *     "stop_on_failure": true,
 *     "capture_output": false,
 *     "enable_logger": false,
 *     "plugins": ["com.example.TimingPlugin"]
 * }
 * </pre>
 */
public final class JsonConfigParser {
    static final String WORKERS_KEY = "workers";
    static final String STOP_ON_FAILURE_KEY = "stop_on_failure";
    static final String CAPTURE_OUTPUT_KEY = "capture_output";
    static final String ENABLE_LOGGER_KEY = "enable_logger";
    static final String PLUGINS_KEY = "plugins";
    private static final Set<String> KNOWN_KEYS = new HashSet<>(Arrays.asList(WORKERS_KEY, STOP_ON_FAILURE_KEY, CAPTURE_OUTPUT_KEY, ENABLE_LOGGER_KEY, PLUGINS_KEY));

    /**
     * Parses the given document over the base configuration.
     *
     * @param json The JSON document.
     * @param base The configuration whose settings apply where the document is silent.
     * @return the resulting configuration.
     * @throws ParseException If the document is malformed, has an unknown key or a value of the wrong type.
     */
    public SessionConfig parse(String json, SessionConfig base) throws ParseException {
        ObjectChecker.assertNonNull(json, base);

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new ParseException(createParseFailureMessage("malformed JSON: " + e.getMessage()));
        }
        if (!parsed.isJsonObject()) {
            throw new ParseException(createParseFailureMessage("configuration is not a JSON object"));
        }

        JsonObject config = parsed.getAsJsonObject();
        for (Map.Entry<String, JsonElement> entry : config.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                throw new ParseException(createParseFailureMessage("unknown key " + entry.getKey()));
            }
        }

        SessionConfig.Builder builder = SessionConfig.Builder.from(base);
        if (config.has(WORKERS_KEY)) {
            int workers = parseAsInt(config, WORKERS_KEY);
            if (workers < 1) {
                throw new ParseException(createParseFailureMessage("expected " + WORKERS_KEY + " to be strictly positive but was " + workers));
            }
            builder.setNumberOfWorkers(workers);
        }
        if (config.has(STOP_ON_FAILURE_KEY)) {
            builder.setWhetherToStopOnFailure(parseAsBoolean(config, STOP_ON_FAILURE_KEY));
        }
        if (config.has(CAPTURE_OUTPUT_KEY)) {
            builder.setWhetherToCaptureOutput(parseAsBoolean(config, CAPTURE_OUTPUT_KEY));
        }
        if (config.has(ENABLE_LOGGER_KEY)) {
            builder.setWhetherToEnableLogger(parseAsBoolean(config, ENABLE_LOGGER_KEY));
        }
        if (config.has(PLUGINS_KEY)) {
            JsonElement plugins = config.get(PLUGINS_KEY);
            if (!plugins.isJsonArray()) {
                throw new ParseException(createParseFailureMessage("expected " + PLUGINS_KEY + " to be a JSON Array"));
            }
            for (JsonElement plugin : plugins.getAsJsonArray()) {
                if (!isString(plugin)) {
                    throw new ParseException(createParseFailureMessage("expected every plugin to be a String"));
                }
                builder.addPluginClassName(plugin.getAsString());
            }
        }
        return builder.build();
    }

    private static String createParseFailureMessage(String cause) {
        return "Failed to parse configuration: " + cause;
    }

    private static boolean parseAsBoolean(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a Boolean"));
        }
        return element.getAsBoolean();
    }

    private static int parseAsInt(JsonObject json, String attribute) throws ParseException {
        JsonElement element = json.get(attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be a Number"));
        }
        double value = element.getAsDouble();
        if ((value != Math.rint(value)) || (value > Integer.MAX_VALUE) || (value < Integer.MIN_VALUE)) {
            throw new ParseException(createParseFailureMessage("expected " + attribute + " to be an integer"));
        }
        return (int) value;
    }

    private static boolean isString(JsonElement element) {
        if (!element.isJsonPrimitive()) {
            return false;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return primitive.isString();
    }
}
