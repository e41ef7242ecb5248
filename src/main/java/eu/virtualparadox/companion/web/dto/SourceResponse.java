package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.companion.rag.index.ScoredChunk;
import org.apache.commons.lang3.StringUtils;

/**
 * A chunk that was put into the prompt, with a short preview of its text.
 */
public record SourceResponse(@JsonProperty("document_id") String documentId,
                             @JsonProperty("chunk_id") String chunkId,
                             @JsonProperty("chunk_index") int chunkIndex,
                             @JsonProperty("page_start") int pageStart,
                             @JsonProperty("page_end") int pageEnd,
                             @JsonProperty("score") float score,
                             @JsonProperty("preview") String preview) {

    static final int PREVIEW_LENGTH = 200;

    public static SourceResponse of(final ScoredChunk chunk) {
        return new SourceResponse(chunk.docId(), chunk.chunkId(), chunk.ordinal(), chunk.fromPage(), chunk.toPage(),
                chunk.score(), StringUtils.left(chunk.text().strip(), PREVIEW_LENGTH));
    }
}
