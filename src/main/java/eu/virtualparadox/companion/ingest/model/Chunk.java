package eu.virtualparadox.companion.ingest.model;

/**
 * Immutable span of a document's extracted text.
 * <p>{@code text} is exactly {@code source.substring(startOffset, endOffset)}. Page numbers are 1-based,
 * or {@code -1} when the source carries no page information.</p>
 */
public record Chunk(String docId,
                    String chunkId,
                    int ordinal,
                    String text,
                    int startOffset,
                    int endOffset,
                    int pageStart,
                    int pageEnd) {

    /** Rough token estimate, four characters per token. */
    public int tokenCount() {
        return (text.length() + 3) / 4;
    }
}
