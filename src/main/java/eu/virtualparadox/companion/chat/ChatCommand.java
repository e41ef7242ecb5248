package eu.virtualparadox.companion.chat;

import java.util.List;

/**
 * @param conversationId existing conversation, or {@code null} to start one
 * @param documentIds    documents to ground the answer in; empty disables retrieval
 */
public record ChatCommand(String conversationId, String message, List<String> documentIds) {

    public ChatCommand {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }
}
