package slate.core.util;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

/**
 * A print stream that delegates to a per-thread print stream.
 *
 * Every thread starts out writing to the stream this object was created over (normally the real {@link System#out} or
 * {@link System#err}). A thread executing a test swaps in a private capture stream for the duration of the test and
 * restores the initial stream afterwards, so concurrent workers never see each other's output.
 */
public final class ThreadLocalPrintStream extends PrintStream {
    private final ThreadLocal<PrintStream> stream;
    private final PrintStream initialStream;

    private ThreadLocalPrintStream(PrintStream initialStream) {
        super(new ByteArrayOutputStream());
        ObjectChecker.assertNonNull(initialStream);
        this.stream = ThreadLocal.withInitial(() -> initialStream);
        this.initialStream = initialStream;
    }

    /**
     * Constructs a new thread local print stream over the specified stream.
     */
    public static ThreadLocalPrintStream withInitialStream(PrintStream stream) {
        return new ThreadLocalPrintStream(stream);
    }

    /**
     * Installs thread local streams as {@link System#out} and {@link System#err} unless they are already installed.
     *
     * Returns true iff this call installed them, in which case the caller is responsible for {@link #uninstall()}.
     */
    public static synchronized boolean install() {
        if ((System.out instanceof ThreadLocalPrintStream) && (System.err instanceof ThreadLocalPrintStream)) {
            return false;
        }
        System.setOut(withInitialStream(System.out));
        System.setErr(withInitialStream(System.err));
        return true;
    }

    /**
     * Restores the streams that were in place before {@link #install()}.
     */
    public static synchronized void uninstall() {
        if (System.out instanceof ThreadLocalPrintStream) {
            System.setOut(((ThreadLocalPrintStream) System.out).initialStream);
        }
        if (System.err instanceof ThreadLocalPrintStream) {
            System.setErr(((ThreadLocalPrintStream) System.err).initialStream);
        }
    }

    /**
     * Sets the stream for the calling thread.
     *
     * @param stream The new stream for this thread.
     */
    public void setStream(PrintStream stream) {
        ObjectChecker.assertNonNull(stream);
        this.stream.set(stream);
    }

    /**
     * Restores the initial stream for the calling thread.
     */
    public void restoreInitialStream() {
        this.stream.set(this.initialStream);
    }

    @Override
    public void write(int b) {
        this.stream.get().write(b);
    }

    @Override
    public void write(byte[] buf, int off, int len) {
        this.stream.get().write(buf, off, len);
    }

    @Override
    public void flush() {
        this.stream.get().flush();
    }

    @Override
    public void close() {
        if (this.stream.get() != this.initialStream) {
            this.stream.get().close();
        }
    }
}
