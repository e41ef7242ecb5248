package eu.virtualparadox.companion.error;

/**
 * Raised when an uploaded file is neither PDF nor plain text.
 */
public class UnsupportedFormatException extends CompanionException {

    public UnsupportedFormatException(final String message) {
        super(message);
    }
}
