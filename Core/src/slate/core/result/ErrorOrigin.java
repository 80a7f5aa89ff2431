package slate.core.result;

/**
 * Where a non-passing result originated.
 */
public enum ErrorOrigin {
    TEST_BODY,
    FIXTURE_SETUP,
    FIXTURE_TEARDOWN,
    HOOK
}
