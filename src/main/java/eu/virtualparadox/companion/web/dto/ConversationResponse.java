package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record ConversationResponse(@JsonProperty("conversation_id") String conversationId,
                                   @JsonProperty("title") String title,
                                   @JsonProperty("messages") List<MessageResponse> messages,
                                   @JsonProperty("created_at") Instant createdAt,
                                   @JsonProperty("updated_at") Instant updatedAt) {
}
