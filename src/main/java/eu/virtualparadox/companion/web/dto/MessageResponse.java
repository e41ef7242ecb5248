package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.companion.conversation.entity.MessageEntity;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public record MessageResponse(@JsonProperty("role") String role,
                              @JsonProperty("content") String content,
                              @JsonProperty("timestamp") Instant timestamp,
                              @JsonProperty("complete") boolean complete,
                              @JsonProperty("sources") List<String> sources) {

    public static MessageResponse of(final MessageEntity message) {
        return new MessageResponse(
                message.getRole().name().toLowerCase(Locale.ROOT),
                message.getContent(),
                message.getCreatedAt(),
                message.isComplete(),
                List.copyOf(message.getSourceChunkIds()));
    }
}
