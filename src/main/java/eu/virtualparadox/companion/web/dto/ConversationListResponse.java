package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.companion.conversation.entity.ConversationEntity;

import java.time.Instant;
import java.util.List;

public record ConversationListResponse(@JsonProperty("conversations") List<Summary> conversations,
                                       @JsonProperty("limit") int limit,
                                       @JsonProperty("offset") int offset) {

    public record Summary(@JsonProperty("conversation_id") String conversationId,
                          @JsonProperty("title") String title,
                          @JsonProperty("created_at") Instant createdAt,
                          @JsonProperty("updated_at") Instant updatedAt) {

        public static Summary of(final ConversationEntity conversation) {
            return new Summary(conversation.getId(), conversation.getTitle(),
                    conversation.getCreatedAt(), conversation.getUpdatedAt());
        }
    }
}
