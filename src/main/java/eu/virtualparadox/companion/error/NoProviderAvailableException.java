package eu.virtualparadox.companion.error;

/**
 * Raised when every generation provider failed before producing output.
 */
public class NoProviderAvailableException extends CompanionException {

    public NoProviderAvailableException(final String message) {
        super(message);
    }

    public NoProviderAvailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
