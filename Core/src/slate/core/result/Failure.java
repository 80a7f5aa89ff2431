package slate.core.result;

import slate.core.util.ObjectChecker;

/**
 * The detail of a non-passing result: a message, where it originated and the underlying cause, if any.
 */
public final class Failure {
    public final String message;
    public final ErrorOrigin origin;
    public final Throwable cause;

    private Failure(String message, ErrorOrigin origin, Throwable cause) {
        this.message = message;
        this.origin = origin;
        this.cause = cause;
    }

    public static Failure of(ErrorOrigin origin, Throwable cause) {
        ObjectChecker.assertNonNull(origin, cause);
        String message = (cause.getMessage() == null) ? cause.getClass().getName() : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new Failure(message, origin, cause);
    }

    public static Failure withMessage(ErrorOrigin origin, String message) {
        ObjectChecker.assertNonNull(origin, message);
        return new Failure(message, origin, null);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { origin: " + this.origin + ", message: " + this.message + " }";
    }
}
