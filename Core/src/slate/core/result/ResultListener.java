package slate.core.result;

/**
 * Consumes the results of a session as they are recorded.
 *
 * Calls are serialized by the session, even in parallel mode, and arrive in the order results are recorded.
 */
public interface ResultListener {

    /**
     * Invoked for every recorded result.
     */
    public void onResult(Result result);

    /**
     * Invoked once when the session is closed.
     */
    public default void onSessionFinished(SessionSummary summary) {
    }
}
