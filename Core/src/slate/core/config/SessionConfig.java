package slate.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The settings of a session.
 *
 * {@link #numWorkers}: 1 runs tests sequentially on the calling thread, more runs them on that many worker threads.
 * {@link #stopOnFailure}: after the first failed or errored test, the tests not yet started are skipped.
 * {@link #captureOutput}: whether test output written to stdout and stderr is captured into each result.
 * {@link #enableLogger}: whether the internal trace logger is enabled.
 * {@link #pluginClassNames}: plugin classes to instantiate and activate before the session starts.
 */
public final class SessionConfig {
    public final int numWorkers;
    public final boolean stopOnFailure;
    public final boolean captureOutput;
    public final boolean enableLogger;
    public final List<String> pluginClassNames;

    private SessionConfig(int numWorkers, boolean stopOnFailure, boolean captureOutput, boolean enableLogger, List<String> pluginClassNames) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be strictly positive but is: " + numWorkers);
        }
        this.numWorkers = numWorkers;
        this.stopOnFailure = stopOnFailure;
        this.captureOutput = captureOutput;
        this.enableLogger = enableLogger;
        this.pluginClassNames = Collections.unmodifiableList(new ArrayList<>(pluginClassNames));
    }

    /**
     * Returns the default configuration: one worker, no stop on failure, output captured, logger disabled, no plugins.
     */
    public static SessionConfig defaults() {
        return Builder.newBuilder().build();
    }

    public boolean isParallel() {
        return this.numWorkers > 1;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { workers: " + this.numWorkers
                + ", " + (this.stopOnFailure ? "[stop on failure]" : "[run all]")
                + ", " + (this.captureOutput ? "[capture output]" : "[no capture]")
                + ", " + (this.enableLogger ? "[logger enabled]" : "[logger disabled]")
                + ", plugins: " + this.pluginClassNames + " }";
    }

    public static class Builder {
        private int numWorkers = 1;
        private boolean stopOnFailure = false;
        private boolean captureOutput = true;
        private boolean enableLogger = false;
        private final List<String> pluginClassNames = new ArrayList<>();

        public static Builder newBuilder() {
            return new Builder();
        }

        /**
         * Returns a builder holding all the settings of the given configuration, to be selectively overridden.
         */
        public static Builder from(SessionConfig config) {
            Builder builder = new Builder();
            builder.numWorkers = config.numWorkers;
            builder.stopOnFailure = config.stopOnFailure;
            builder.captureOutput = config.captureOutput;
            builder.enableLogger = config.enableLogger;
            builder.pluginClassNames.addAll(config.pluginClassNames);
            return builder;
        }

        public Builder setNumberOfWorkers(int num) {
            this.numWorkers = num;
            return this;
        }

        public Builder setWhetherToStopOnFailure(boolean stop) {
            this.stopOnFailure = stop;
            return this;
        }

        public Builder setWhetherToCaptureOutput(boolean capture) {
            this.captureOutput = capture;
            return this;
        }

        public Builder setWhetherToEnableLogger(boolean enable) {
            this.enableLogger = enable;
            return this;
        }

        public Builder addPluginClassName(String className) {
            if (className == null) {
                throw new NullPointerException("className must be non-null.");
            }
            if (!this.pluginClassNames.contains(className)) {
                this.pluginClassNames.add(className);
            }
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this.numWorkers, this.stopOnFailure, this.captureOutput, this.enableLogger, this.pluginClassNames);
        }
    }
}
