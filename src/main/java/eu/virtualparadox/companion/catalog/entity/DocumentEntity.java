package eu.virtualparadox.companion.catalog.entity;

import eu.virtualparadox.companion.catalog.EDocumentStatus;
import eu.virtualparadox.companion.catalog.converter.PathConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.file.Path;
import java.time.Instant;

@Entity
@Table(name = "documents")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "original_filename", length = 512, nullable = false)
    private String originalFilename;

    @Column(length = 128, nullable = false)
    private String mime;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "chunk_count", nullable = false)
    private int chunkCount;

    @Column(name = "embed_model", length = 128, nullable = false)
    private String embedModel;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "ingested_at")
    private Instant ingestedAt;

    @Column(name = "blob_path", length = 1024, nullable = false)
    @Convert(converter = PathConverter.class)
    private Path blobPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private EDocumentStatus status;

    @Column(name = "error", length = 2048)
    private String error;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }

        if (embedModel == null) {
            embedModel = "unknown";
        }

        if (status == null) {
            status = EDocumentStatus.PROCESSING;
        }
    }
}
