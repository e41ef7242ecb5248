package eu.virtualparadox.companion.error;

/**
 * Raised when the configured embedding backend cannot produce vectors.
 */
public class EmbeddingUnavailableException extends CompanionException {

    public EmbeddingUnavailableException(final String message) {
        super(message);
    }

    public EmbeddingUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
