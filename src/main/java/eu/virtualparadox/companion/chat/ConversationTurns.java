package eu.virtualparadox.companion.chat;

import eu.virtualparadox.companion.error.ConversationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversations with a turn in flight. A turn holds its conversation from the moment the user
 * message is accepted until the answer is finalized; entries exist only while a turn runs.
 */
@Slf4j
@Component
public class ConversationTurns {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @throws ConversationBusyException if another turn of the conversation is still running
     */
    public void begin(final String conversationId) {
        if (!inFlight.add(conversationId)) {
            throw new ConversationBusyException(
                    "Conversation " + conversationId + " is still answering the previous message");
        }
    }

    public void end(final String conversationId) {
        if (inFlight.remove(conversationId)) {
            log.debug("Conversation {}: turn released", conversationId);
        }
    }

    public boolean isActive(final String conversationId) {
        return inFlight.contains(conversationId);
    }
}
