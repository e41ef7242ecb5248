package eu.virtualparadox.companion.error;

/**
 * Raised when a provider fails after it already emitted fragments. The partial answer is kept.
 */
public class StreamInterruptedException extends CompanionException {

    public StreamInterruptedException(final String message) {
        super(message);
    }

    public StreamInterruptedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
