package eu.virtualparadox.companion.rag.retriever;

import eu.virtualparadox.companion.application.config.ApplicationConfig;
import eu.virtualparadox.companion.catalog.service.DocumentCatalogService;
import eu.virtualparadox.companion.error.IndexCorruptionException;
import eu.virtualparadox.companion.rag.embed.EmbeddingService;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import eu.virtualparadox.companion.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic retrieval over ready documents.
 * <ol>
 *   <li>Restrict the requested document ids to documents whose ingestion finished</li>
 *   <li>Embed the query with {@link EmbeddingService}</li>
 *   <li>Run the filtered k-NN search against {@link VectorIndexService}</li>
 * </ol>
 * Nothing to search in yields an empty list, never an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final DocumentCatalogService catalogService;
    private final ApplicationConfig config;

    public List<ScoredChunk> retrieve(final String query, final Collection<String> documentIds) {
        return retrieve(query, documentIds, config.getRetrieval().getTopK());
    }

    /**
     * @param documentIds documents to search; {@code null} or empty means all ready documents
     * @param k           maximum number of chunks
     */
    public List<ScoredChunk> retrieve(final String query, final Collection<String> documentIds, final int k) {
        final Set<String> ready = catalogService.readyIds();
        final Set<String> scope;
        if (documentIds == null || documentIds.isEmpty()) {
            scope = ready;
        } else {
            scope = new LinkedHashSet<>(documentIds);
            scope.retainAll(ready);
        }

        if (scope.isEmpty() || query == null || query.isBlank()) {
            log.debug("Nothing to retrieve from (requested={}, ready={})", documentIds, ready.size());
            return List.of();
        }

        final float[] queryVector = embeddingService.embedQuery(query);
        try {
            final List<ScoredChunk> hits = vectorIndexService.search(queryVector, k, scope);
            log.debug("Retrieved {} chunks from {} documents", hits.size(), scope.size());
            return hits;
        } catch (IOException e) {
            throw new IndexCorruptionException("Vector search failed", e);
        }
    }
}
