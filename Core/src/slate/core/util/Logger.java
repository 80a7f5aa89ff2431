package slate.core.util;

import java.io.PrintStream;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Loggers write to the process streams as they were when this class was first loaded, so that anything logged while a
 * test has its output captured still reaches the console rather than the test's captured output.
 */
public final class Logger {
    private static final PrintStream OUT = System.out;
    private static final PrintStream ERR = System.err;
    private static volatile boolean globalEnabled = false;
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    public static boolean isGloballyEnabled() {
        return globalEnabled;
    }

    /**
     * Logs the specified message to stdout if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            OUT.println(prefix() + message);
        }
    }

    /**
     * Logs the specified warning to stderr if logging is enabled.
     *
     * @param message The message to log.
     */
    public void warn(String message) {
        if (globalEnabled) {
            ERR.println(prefix() + "WARN " + message);
        }
    }

    /**
     * Logs the specified warning and the stack trace of its cause to stderr if logging is enabled.
     *
     * @param message The message to log.
     * @param cause The cause of the warning.
     */
    public void warn(String message, Throwable cause) {
        if (globalEnabled) {
            ERR.println(prefix() + "WARN " + message);
            if (cause != null) {
                cause.printStackTrace(ERR);
            }
        }
    }

    private String prefix() {
        return "[" + Thread.currentThread().getName() + "] " + this.className + ": ";
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + " }";
    }
}
