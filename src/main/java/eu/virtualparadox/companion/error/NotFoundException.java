package eu.virtualparadox.companion.error;

public class NotFoundException extends CompanionException {

    public NotFoundException(final String message) {
        super(message);
    }
}
