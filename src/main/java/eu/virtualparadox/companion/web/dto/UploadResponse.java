package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadResponse(@JsonProperty("document_id") String documentId,
                             @JsonProperty("filename") String filename,
                             @JsonProperty("status") String status) {
}
