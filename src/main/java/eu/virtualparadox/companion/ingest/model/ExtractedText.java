package eu.virtualparadox.companion.ingest.model;

/**
 * Cleaned document text plus a per-character page map of the same length.
 */
public record ExtractedText(String text, int[] pageMap, int pageCount) {

    public ExtractedText {
        if (pageMap != null && pageMap.length != text.length()) {
            throw new IllegalArgumentException("pageMap length " + pageMap.length + " != text length " + text.length());
        }
    }
}
