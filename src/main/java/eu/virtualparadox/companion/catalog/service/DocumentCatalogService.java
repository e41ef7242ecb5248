package eu.virtualparadox.companion.catalog.service;

import eu.virtualparadox.companion.application.config.ApplicationConfig;
import eu.virtualparadox.companion.catalog.EDocumentStatus;
import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import eu.virtualparadox.companion.catalog.repo.DocumentRepository;
import eu.virtualparadox.companion.error.NotFoundException;
import eu.virtualparadox.companion.ingest.extractor.TextExtractorRegistry;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Service layer responsible for managing the document catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Persisting uploaded documents to the filesystem under {@code companion.blob}</li>
 *     <li>Maintaining metadata records in the relational catalog (H2)</li>
 *     <li>Guarded status transitions of the ingestion lifecycle</li>
 * </ul>
 *
 * <p>Vector indexing is handled separately, with the document id acting as the link.</p>
 */
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    /** Placeholder until the document is embedded. */
    private static final String DEFAULT_EMBED_MODEL = "unknown";

    /** Fallback MIME type if detection fails. */
    private static final String DEFAULT_MIME = "application/octet-stream";

    private static final String TEMP_FILE_PREFIX = "up-";
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private static final int MAX_ERROR_LENGTH = 2000;

    private final DocumentRepository repository;
    private final ApplicationConfig props;

    /**
     * Saves an uploaded document into blob storage and registers it as {@link EDocumentStatus#PROCESSING}.
     *
     * <p>Steps performed:
     * <ol>
     *     <li>Generates a new unique identifier for the document</li>
     *     <li>Writes the uploaded content to disk atomically (temp file, then move)</li>
     *     <li>Detects MIME type if not explicitly provided</li>
     *     <li>Persists metadata in the relational database</li>
     * </ol>
     *
     * @param originalFilename the original filename provided by the user
     * @param mime             the MIME type, may be {@code null} or blank
     * @param content          input stream with the document bytes (caller is responsible for closing)
     * @return the persisted {@link DocumentEntity}
     * @throws IOException if writing to the filesystem fails
     */
    @Transactional
    public DocumentEntity save(final String originalFilename,
                               final String mime,
                               final InputStream content) throws IOException {

        final String id = generateId();
        final String ext = TextExtractorRegistry.extensionOf(originalFilename);

        final Path blobsDir = props.getBlob();
        Files.createDirectories(blobsDir);

        final Path target = blobsDir.resolve(id + ext);
        final Path temp = Files.createTempFile(blobsDir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);

        final long bytes = Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        final String detectedMime;
        if (StringUtils.isBlank(mime)) {
            final String probed = Files.probeContentType(target);
            detectedMime = probed != null ? probed : DEFAULT_MIME;
        } else {
            detectedMime = mime;
        }

        final DocumentEntity entity = DocumentEntity.builder()
                .id(id)
                .originalFilename(originalFilename)
                .mime(detectedMime)
                .sizeBytes(bytes)
                .chunkCount(0)
                .embedModel(DEFAULT_EMBED_MODEL)
                .createdAt(Instant.now())
                .blobPath(target)
                .status(EDocumentStatus.PROCESSING)
                .build();

        return repository.save(entity);
    }

    /**
     * @return every document, newest first
     */
    @Transactional(readOnly = true)
    public List<DocumentEntity> listAll() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<DocumentEntity> findById(final String id) {
        return repository.findById(id);
    }

    /**
     * @throws NotFoundException if the document does not exist
     */
    @Transactional(readOnly = true)
    public DocumentEntity require(final String id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Document not found: " + id));
    }

    @Transactional(readOnly = true)
    public Set<String> readyIds() {
        return new HashSet<>(repository.findIdsByStatus(EDocumentStatus.READY));
    }

    /**
     * Deletes a document from both catalog and blob storage.
     * <p>Vector index deletion is performed separately.</p>
     *
     * @param id the document identifier
     * @throws IOException if deleting the blob file fails
     */
    @Transactional
    public void delete(final String id) throws IOException {
        final Optional<DocumentEntity> entityOpt = repository.findById(id);
        if (entityOpt.isPresent()) {
            final DocumentEntity doc = entityOpt.get();
            if (doc.getBlobPath() != null) {
                Files.deleteIfExists(doc.getBlobPath());
            }
            repository.deleteById(id);
        }
    }

    /**
     * @return {@code false} if the document is no longer {@code PROCESSING} (e.g. deleted meanwhile)
     */
    @Transactional
    public boolean markReady(final String id, final int chunks, final String embedModel) {
        return repository.markReady(id, chunks, embedModel, Instant.now()) == 1;
    }

    @Transactional
    public boolean markFailed(final String id, final String error) {
        return repository.markFailed(id, StringUtils.abbreviate(StringUtils.defaultString(error), MAX_ERROR_LENGTH)) == 1;
    }

    /**
     * Moves a failed document back to {@code PROCESSING}.
     *
     * @return {@code false} if the document was not {@code FAILED}
     */
    @Transactional
    public boolean markReprocessing(final String id) {
        return repository.transition(id, EDocumentStatus.FAILED, EDocumentStatus.PROCESSING) == 1;
    }

    /**
     * UUID with dashes removed.
     */
    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
