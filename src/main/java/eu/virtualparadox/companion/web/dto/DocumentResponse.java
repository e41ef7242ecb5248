package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.companion.catalog.entity.DocumentEntity;

import java.time.Instant;
import java.util.Locale;

public record DocumentResponse(@JsonProperty("id") String id,
                               @JsonProperty("original_filename") String originalFilename,
                               @JsonProperty("stored_filename") String storedFilename,
                               @JsonProperty("content_type") String contentType,
                               @JsonProperty("size_bytes") long sizeBytes,
                               @JsonProperty("status") String status,
                               @JsonProperty("chunk_count") int chunkCount,
                               @JsonProperty("error") String error,
                               @JsonProperty("embed_model") String embedModel,
                               @JsonProperty("created_at") Instant createdAt,
                               @JsonProperty("ingested_at") Instant ingestedAt) {

    public static DocumentResponse of(final DocumentEntity document) {
        return new DocumentResponse(
                document.getId(),
                document.getOriginalFilename(),
                document.getBlobPath() != null ? document.getBlobPath().getFileName().toString() : null,
                document.getMime(),
                document.getSizeBytes(),
                document.getStatus().name().toLowerCase(Locale.ROOT),
                document.getChunkCount(),
                document.getError(),
                document.getEmbedModel(),
                document.getCreatedAt(),
                document.getIngestedAt());
    }
}
