package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.companion.rag.citation.Citation;

import java.util.List;

public record CitationResponse(@JsonProperty("document_id") String documentId,
                               @JsonProperty("filename") String filename,
                               @JsonProperty("label") String label,
                               @JsonProperty("chunk_ids") List<String> chunkIds) {

    public static CitationResponse of(final Citation citation) {
        return new CitationResponse(citation.docId(), citation.filename(), citation.asString(), citation.chunkIds());
    }
}
