package eu.virtualparadox.companion.error;

/**
 * Raised when the vector index disagrees with the catalog about a document.
 */
public class IndexCorruptionException extends CompanionException {

    public IndexCorruptionException(final String message) {
        super(message);
    }

    public IndexCorruptionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
