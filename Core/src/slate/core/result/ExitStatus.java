package slate.core.result;

/**
 * The process exit status of a run.
 */
public enum ExitStatus {
    SUCCESS(0),
    TESTS_FAILED(1),
    INTERRUPTED(2),
    INTERNAL_ERROR(3),
    COLLECTION_OR_CONFIGURATION_ERROR(4);

    public final int code;

    ExitStatus(int code) {
        this.code = code;
    }
}
