package eu.virtualparadox.companion.rag.citation;

import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import eu.virtualparadox.companion.catalog.service.DocumentCatalogService;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns retrieved chunks into per-document {@link Citation}s.
 * <ol>
 *   <li>Group the chunks by document id, in first-seen order.</li>
 *   <li>Merge the page spans of each document with {@link PageInterval#merge(List)}.</li>
 *   <li>Attach the original filename from the catalog.</li>
 * </ol>
 * Documents deleted since retrieval are left out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CitationResolverService {

    private final DocumentCatalogService documentCatalogService;

    public List<Citation> resolve(final List<ScoredChunk> chunks) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        if (chunks.isEmpty()) {
            return Collections.emptyList();
        }

        final Map<String, List<ScoredChunk>> chunksByDocument = new LinkedHashMap<>();
        for (final ScoredChunk chunk : chunks) {
            chunksByDocument.computeIfAbsent(chunk.docId(), k -> new ArrayList<>()).add(chunk);
        }

        final List<Citation> result = new ArrayList<>(chunksByDocument.size());
        for (final Map.Entry<String, List<ScoredChunk>> entry : chunksByDocument.entrySet()) {
            final Optional<DocumentEntity> document = documentCatalogService.findById(entry.getKey());
            if (document.isEmpty()) {
                log.debug("Cited document {} no longer exists", entry.getKey());
                continue;
            }

            final List<PageInterval> intervals = new ArrayList<>();
            final List<String> chunkIds = new ArrayList<>();
            for (final ScoredChunk chunk : entry.getValue()) {
                chunkIds.add(chunk.chunkId());
                if (chunk.fromPage() > 0 && chunk.toPage() >= chunk.fromPage()) {
                    intervals.add(new PageInterval(chunk.fromPage(), chunk.toPage()));
                }
            }

            result.add(new Citation(entry.getKey(), document.get().getOriginalFilename(),
                    PageInterval.merge(intervals), chunkIds));
        }
        return Collections.unmodifiableList(result);
    }
}
