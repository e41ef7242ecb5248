package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatRequest(@JsonProperty("message") String message,
                          @JsonProperty("conversation_id") String conversationId,
                          @JsonProperty("document_ids") List<String> documentIds,
                          @JsonProperty("stream") boolean stream) {
}
