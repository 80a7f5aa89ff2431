package slate.core.exception;

/**
 * Describes the failure of a single fixture teardown action. Recorded as its own result; never prevents the remaining
 * teardown actions or later tests from running.
 */
public final class FixtureTeardownException extends Exception {
    public final String fixtureName;
    public final String scopeDescriptor;

    public FixtureTeardownException(String fixtureName, String scopeDescriptor, Throwable cause) {
        super("Teardown of fixture '" + fixtureName + "' in " + scopeDescriptor + " failed: " + FixtureSetupException.describe(cause), cause);
        this.fixtureName = fixtureName;
        this.scopeDescriptor = scopeDescriptor;
    }
}
