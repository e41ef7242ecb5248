package eu.virtualparadox.companion.ingest.cleaner;

/**
 * Result of text cleaning operation. The page map stays aligned with the cleaned text.
 */
public record CleaningResult(String cleanText, int[] pageMap) {

    public CleaningResult {
        if (cleanText.length() != pageMap.length) {
            throw new IllegalStateException(
                    "Cleaning broke the invariant: text length " + cleanText.length() +
                            " != pageMap length " + pageMap.length
            );
        }
    }
}
