package eu.virtualparadox.companion.rag.index;

/**
 * A chunk returned by a vector search. {@code score} is the cosine similarity to the query.
 */
public record ScoredChunk(String docId,
                          String chunkId,
                          int ordinal,
                          String text,
                          int fromPage,
                          int toPage,
                          float score) {
}
