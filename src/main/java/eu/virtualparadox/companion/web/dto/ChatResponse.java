package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record ChatResponse(@JsonProperty("conversation_id") String conversationId,
                           @JsonProperty("response") String response,
                           @JsonProperty("timestamp") Instant timestamp,
                           @JsonProperty("sources") List<SourceResponse> sources,
                           @JsonProperty("citations") List<CitationResponse> citations) {
}
