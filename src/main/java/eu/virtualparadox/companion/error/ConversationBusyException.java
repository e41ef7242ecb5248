package eu.virtualparadox.companion.error;

/**
 * A turn was started on a conversation that is still answering the previous one.
 */
public class ConversationBusyException extends CompanionException {

    public ConversationBusyException(final String message) {
        super(message);
    }
}
