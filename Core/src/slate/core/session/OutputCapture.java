package slate.core.session;

import slate.core.util.ThreadLocalPrintStream;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Captures what the calling thread writes to {@link System#out} and {@link System#err} while a test runs.
 *
 * Capturing hijacks the calling thread's slot of the installed {@link ThreadLocalPrintStream}s; other threads keep
 * writing to the console. When thread local streams are not installed nothing is captured.
 */
final class OutputCapture {
    private final ByteArrayOutputStream stdout;
    private final ByteArrayOutputStream stderr;

    private OutputCapture(ByteArrayOutputStream stdout, ByteArrayOutputStream stderr) {
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * Starts capturing the calling thread's output, if possible.
     */
    static OutputCapture start() {
        return new OutputCapture(hijackStream(System.out), hijackStream(System.err));
    }

    /**
     * Returns a capture that captures nothing.
     */
    static OutputCapture disabled() {
        return new OutputCapture(null, null);
    }

    /**
     * Stops capturing, restores the calling thread's streams and returns the captured stdout.
     */
    String stopAndGetStdout() {
        return closeAndRestoreHijackedStream(System.out, this.stdout);
    }

    /**
     * Stops capturing, restores the calling thread's streams and returns the captured stderr.
     */
    String stopAndGetStderr() {
        return closeAndRestoreHijackedStream(System.err, this.stderr);
    }

    private static ByteArrayOutputStream hijackStream(PrintStream stream) {
        if (!(stream instanceof ThreadLocalPrintStream)) {
            return null;
        }
        ByteArrayOutputStream hijacker = new ByteArrayOutputStream();
        ((ThreadLocalPrintStream) stream).setStream(new PrintStream(hijacker, true));
        return hijacker;
    }

    private static String closeAndRestoreHijackedStream(PrintStream hijackedStream, ByteArrayOutputStream hijacker) {
        if ((hijacker == null) || !(hijackedStream instanceof ThreadLocalPrintStream)) {
            return "";
        }
        ThreadLocalPrintStream hijackedThreadLocal = (ThreadLocalPrintStream) hijackedStream;
        hijackedThreadLocal.flush();
        String contents = new String(hijacker.toByteArray(), StandardCharsets.UTF_8);
        hijackedThreadLocal.close();
        hijackedThreadLocal.restoreInitialStream();
        return contents;
    }
}
