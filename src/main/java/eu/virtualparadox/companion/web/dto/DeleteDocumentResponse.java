package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteDocumentResponse(@JsonProperty("message") String message,
                                     @JsonProperty("chunks_removed") int chunksRemoved) {
}
