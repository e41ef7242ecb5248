package eu.virtualparadox.companion.ingest.chunker;

import eu.virtualparadox.companion.ingest.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sliding-window {@code Chunker} that prefers to cut at sentence or paragraph boundaries.
 *
 * <h2>Algorithm</h2>
 * A window of {@code chunkSize} characters starts at position {@code p}.
 * <ul>
 *   <li>If the window reaches the end of the text it becomes the last chunk.</li>
 *   <li>Otherwise the window is cut at the last boundary {@code b} with
 *       {@code p + overlap < b <= p + chunkSize}; with no such boundary it is cut hard
 *       at {@code p + chunkSize}.</li>
 *   <li>The next window starts at {@code cut - overlap}, so consecutive chunks share
 *       exactly {@code overlap} characters.</li>
 * </ul>
 * A boundary is the offset at which a sentence or a paragraph starts. Since every cut lies
 * strictly after {@code p + overlap}, each window advances and every character of the input
 * lands in at least one chunk.
 *
 * <h2>Sentence detection</h2>
 * A sentence ends at {@code .}, {@code !} or {@code ?}, followed by whitespace, and the next
 * sentence starts with an uppercase letter or a quote. Common abbreviations such as
 * {@code Dr.} or {@code Jan.} do not end a sentence.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. For a given {@code (text, chunkSize, overlap)} the boundaries
 * are always the same.
 */
@Component
public class Chunker {

    private final int chunkSize;
    private final int overlap;

    /**
     * Unicode-capital-aware sentence boundary:
     * <pre>
     *     (?&lt;=[.!?])     # trailing ., ! or ? must precede the split
     *     (?![.!?])        # do not allow runs of punctuation to trigger multiple splits
     *     \s+              # one or more whitespace characters form the divider
     *     (?=[\p{Lu}"'])   # next sentence starts with uppercase/quote
     * </pre>
     */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])" +
                    "(?![.!?])" +
                    "\\s+" +
                    "(?=[\\p{Lu}\"'])"
    );

    private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n[ \\t]*\\n\\s*");

    /**
     * Matches when the text right before a split candidate ends with a known abbreviation.
     */
    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    private static final int ABBREVIATION_WINDOW = 20;

    /**
     * @param chunkSize window length in characters (must be {@code > 0})
     * @param overlap   characters shared by consecutive chunks ({@code 0 <= overlap < chunkSize})
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${companion.chunking.size:500}") final int chunkSize,
                   @Value("${companion.chunking.overlap:50}") final int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be non-negative and less than chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<Chunk> chunk(final String docId, final String text) {
        return chunk(docId, text, null);
    }

    /**
     * Splits {@code text} into overlapping chunks.
     *
     * @param docId   document identifier (non-blank), used as chunk id prefix
     * @param text    cleaned document text
     * @param pageMap optional page of every character; same length as {@code text}
     * @return chunks in document order, empty for blank text
     * @throws IllegalArgumentException if inputs are invalid
     */
    public List<Chunk> chunk(final String docId, final String text, final int[] pageMap) {
        validateInputs(docId, text, pageMap);

        final List<Chunk> result = new ArrayList<>();
        if (text.isBlank()) {
            return result;
        }

        final int length = text.length();
        final int[] boundaries = boundaries(text);

        int start = 0;
        int ordinal = 0;
        while (true) {
            final int limit = start + chunkSize;
            if (limit >= length) {
                result.add(createChunk(docId, text, ordinal, start, length, pageMap));
                break;
            }

            int cut = lastBoundaryIn(boundaries, start + overlap, limit);
            if (cut < 0) {
                cut = limit;
            }
            result.add(createChunk(docId, text, ordinal++, start, cut, pageMap));
            start = cut - overlap;
        }
        return result;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    private void validateInputs(final String docId, final String text, final int[] pageMap) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (pageMap != null && pageMap.length != text.length()) {
            throw new IllegalArgumentException("pageMap length must match text length");
        }
    }

    private static Chunk createChunk(final String docId,
                                     final String text,
                                     final int ordinal,
                                     final int start,
                                     final int end,
                                     final int[] pageMap) {
        final int pageStart = pageOf(pageMap, start);
        final int pageEnd = pageOf(pageMap, Math.max(end - 1, start));
        return new Chunk(docId, chunkId(docId, ordinal), ordinal, text.substring(start, end),
                start, end, pageStart, pageEnd);
    }

    /**
     * Builds a stable chunk identifier: {@code {docId}_{ordinal(5 digits)}}.
     */
    public static String chunkId(final String docId, final int ordinal) {
        return docId + "_" + String.format("%05d", ordinal);
    }

    private static int pageOf(final int[] pageMap, final int charIndex) {
        if (pageMap == null || pageMap.length == 0) {
            return -1;
        }
        final int idx = Math.max(0, Math.min(charIndex, pageMap.length - 1));
        return pageMap[idx];
    }

    /**
     * Largest boundary {@code b} with {@code lowExclusive < b <= highInclusive}, or {@code -1}.
     */
    private static int lastBoundaryIn(final int[] boundaries, final int lowExclusive, final int highInclusive) {
        int idx = Arrays.binarySearch(boundaries, highInclusive);
        if (idx < 0) {
            // insertion point minus one is the last element below highInclusive
            idx = -idx - 2;
        }
        if (idx >= 0 && boundaries[idx] > lowExclusive) {
            return boundaries[idx];
        }
        return -1;
    }

    /**
     * Offsets where a sentence or paragraph starts, ascending and without duplicates.
     */
    private static int[] boundaries(final String text) {
        final TreeSet<Integer> offsets = new TreeSet<>();

        final Matcher sentence = SENTENCE_SPLIT.matcher(text);
        while (sentence.find()) {
            final int splitPoint = sentence.start();
            final String beforeSplit = text.substring(Math.max(0, splitPoint - ABBREVIATION_WINDOW), splitPoint).trim();
            if (!ABBREVIATION_PATTERN.matcher(beforeSplit).find()) {
                offsets.add(sentence.end());
            }
        }

        final Matcher paragraph = PARAGRAPH_SPLIT.matcher(text);
        while (paragraph.find()) {
            if (paragraph.end() < text.length()) {
                offsets.add(paragraph.end());
            }
        }

        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }
}
