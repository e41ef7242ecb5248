package eu.virtualparadox.companion.error;

/**
 * Base class of the failures the HTTP layer translates into status codes.
 */
public abstract class CompanionException extends RuntimeException {

    protected CompanionException(final String message) {
        super(message);
    }

    protected CompanionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
