package eu.virtualparadox.companion.rag.index;

import eu.virtualparadox.companion.ingest.model.Chunk;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Chunk vector store with nearest-neighbour search.
 */
public interface VectorIndexService {

    /**
     * Replaces all chunks of {@code docId}. Searchers observe either the old or the new set, never a mix.
     */
    void upsert(String docId, List<Chunk> chunks, List<float[]> vectors) throws IOException;

    /**
     * @param docFilter documents to search in; {@code null} means every document
     * @return at most {@code k} chunks by descending score, ties by ascending chunk id
     */
    List<ScoredChunk> search(float[] queryVector, int k, Collection<String> docFilter) throws IOException;

    /**
     * @return number of chunks removed
     */
    int deleteByDocument(String docId) throws IOException;

    int countByDocument(String docId) throws IOException;
}
