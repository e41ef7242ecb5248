package eu.virtualparadox.companion.util;

public final class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_FROM_PAGE = "fromPage";
    public static final String FIELD_TO_PAGE = "toPage";

    private LuceneConstants() {
        // prevent instantiation
    }
}
