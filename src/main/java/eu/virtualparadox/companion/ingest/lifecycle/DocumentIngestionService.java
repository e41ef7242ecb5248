package eu.virtualparadox.companion.ingest.lifecycle;

import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import eu.virtualparadox.companion.catalog.service.DocumentCatalogService;
import eu.virtualparadox.companion.error.IndexCorruptionException;
import eu.virtualparadox.companion.ingest.chunker.Chunker;
import eu.virtualparadox.companion.ingest.extractor.TextExtractorRegistry;
import eu.virtualparadox.companion.ingest.model.Chunk;
import eu.virtualparadox.companion.ingest.model.ExtractedText;
import eu.virtualparadox.companion.rag.embed.EmbeddingService;
import eu.virtualparadox.companion.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Indexing pipeline for one document:
 * <ol>
 *     <li>Extract and clean the text (PDF or plain text)</li>
 *     <li>Chunk it with {@link Chunker}</li>
 *     <li>Embed the chunks, outside of the index lock</li>
 *     <li>Upsert chunks and vectors into the Lucene HNSW index and verify the stored count</li>
 *     <li>Mark the catalog record ready with its chunk count</li>
 * </ol>
 * Any failure removes whatever was written to the index and marks the document failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final TextExtractorRegistry extractors;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final DocumentCatalogService catalogService;

    /**
     * Runs the pipeline synchronously.
     *
     * @return {@code true} if the document ended up ready
     */
    public boolean ingest(final DocumentEntity document) {
        final String id = document.getId();
        try {
            final int chunkCount = index(document);
            if (!catalogService.markReady(id, chunkCount, embeddingService.modelName())) {
                // deleted (or failed) while we were indexing
                log.info("Document {} left PROCESSING during ingestion, dropping its chunks", id);
                vectorIndexService.deleteByDocument(id);
                return false;
            }
            log.info("Ingested document {} ({}) into {} chunks", id, document.getOriginalFilename(), chunkCount);
            return true;
        } catch (Exception e) {
            log.error("Ingestion failed for document {} ({})", id, document.getOriginalFilename(), e);
            rollback(id);
            catalogService.markFailed(id, describe(e));
            return false;
        }
    }

    private int index(final DocumentEntity document) throws IOException {
        final String id = document.getId();

        final ExtractedText extracted = extractors.extract(document.getOriginalFilename(), document.getBlobPath());
        final List<Chunk> chunks = chunker.chunk(id, extracted.text(), extracted.pageMap());
        if (chunks.isEmpty()) {
            log.warn("Document {} contains no text", id);
            vectorIndexService.deleteByDocument(id);
            return 0;
        }

        final List<float[]> vectors = embeddingService.embed(chunks.stream().map(Chunk::text).toList());
        vectorIndexService.upsert(id, chunks, vectors);

        final int stored = vectorIndexService.countByDocument(id);
        if (stored != chunks.size()) {
            throw new IndexCorruptionException("Index holds " + stored + " chunks for document " + id
                    + ", expected " + chunks.size());
        }
        return chunks.size();
    }

    private void rollback(final String id) {
        try {
            vectorIndexService.deleteByDocument(id);
        } catch (IOException e) {
            log.error("Unable to remove chunks of failed document {}", id, e);
        }
    }

    private static String describe(final Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
