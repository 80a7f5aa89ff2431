package slate.core.session;

/**
 * The phases of a session. A session only ever moves forward through these phases; a fatal collection or fixture graph
 * error moves it from {@link #COLLECTING} straight to {@link #CLOSED}.
 */
public enum SessionPhase {
    IDLE,
    COLLECTING,
    RUNNING,
    FINALIZING,
    CLOSED;

    boolean canTransitionTo(SessionPhase next) {
        switch (this) {
            case IDLE: return next == COLLECTING;
            case COLLECTING: return (next == RUNNING) || (next == CLOSED);
            case RUNNING: return next == FINALIZING;
            case FINALIZING: return next == CLOSED;
            default: return false;
        }
    }
}
