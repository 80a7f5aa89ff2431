package slate.core.result;

/**
 * The outcome of a result.
 */
public enum Outcome {
    PASSED,
    FAILED,
    ERROR,
    SKIPPED,
    INTERRUPTED;

    /**
     * Returns true iff this outcome should make the run exit with a failure status.
     */
    public boolean isFailure() {
        return (this == FAILED) || (this == ERROR);
    }
}
