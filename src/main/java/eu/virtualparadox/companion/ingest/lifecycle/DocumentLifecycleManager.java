package eu.virtualparadox.companion.ingest.lifecycle;

import eu.virtualparadox.companion.application.executor.IngestionExecutor;
import eu.virtualparadox.companion.catalog.EDocumentStatus;
import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import eu.virtualparadox.companion.catalog.service.DocumentCatalogService;
import eu.virtualparadox.companion.ingest.extractor.TextExtractorRegistry;
import eu.virtualparadox.companion.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Manages the full lifecycle of documents:
 * <ul>
 *   <li>Catalog (database)</li>
 *   <li>Blob storage (filesystem)</li>
 *   <li>Vector index (Lucene)</li>
 * </ul>
 * Ingestion runs on the {@link IngestionExecutor}; callers get the {@code PROCESSING} record back immediately.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private final DocumentCatalogService catalogService;
    private final TextExtractorRegistry extractors;
    private final VectorIndexService vectorIndexService;
    private final DocumentIngestionService ingestionService;
    private final IngestionExecutor ingestionExecutor;

    /**
     * Stores the upload and queues its ingestion.
     *
     * @throws eu.virtualparadox.companion.error.UnsupportedFormatException before anything is stored
     */
    public DocumentEntity upload(final String fileName, final String mimeType, final InputStream is) throws IOException {
        extractors.requireSupported(fileName);

        final DocumentEntity saved = catalogService.save(fileName, mimeType, is);
        log.info("Stored upload {} as document {} ({} bytes)", fileName, saved.getId(), saved.getSizeBytes());
        submit(saved);
        return saved;
    }

    /**
     * Re-runs ingestion of a failed document.
     *
     * @throws IllegalStateException if the document is not {@link EDocumentStatus#FAILED}
     */
    public DocumentEntity reingest(final String id) {
        final DocumentEntity doc = catalogService.require(id);
        if (!catalogService.markReprocessing(id)) {
            throw new IllegalStateException("Only failed documents can be re-ingested; " + id + " is " + doc.getStatus());
        }
        doc.setStatus(EDocumentStatus.PROCESSING);
        doc.setError(null);
        submit(doc);
        return doc;
    }

    /**
     * Deletes a document and all associated artifacts, index entries first.
     *
     * @return number of chunks removed from the index
     */
    public int deleteDocument(final String id) throws IOException {
        catalogService.require(id);

        int removed = vectorIndexService.deleteByDocument(id);
        catalogService.delete(id);
        // an ingestion in flight may have written chunks between the two steps above
        removed += vectorIndexService.deleteByDocument(id);

        log.info("Deleted document {} from catalog, blob storage, and index ({} chunks)", id, removed);
        return removed;
    }

    public List<DocumentEntity> listAll() {
        return catalogService.listAll();
    }

    public DocumentEntity get(final String id) {
        return catalogService.require(id);
    }

    private void submit(final DocumentEntity doc) {
        try {
            ingestionExecutor.execute(() -> {
                log.info("Asynchronous ingestion started for {}", doc.getId());
                ingestionService.ingest(doc);
            });
        } catch (TaskRejectedException e) {
            catalogService.markFailed(doc.getId(), "Ingestion queue is full");
            throw e;
        }
    }
}
