package eu.virtualparadox.companion.ingest.chunker;

import eu.virtualparadox.companion.ingest.model.Chunk;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ChunkerTest {

    private static final int SIZE = 500;
    private static final int OVERLAP = 50;

    private final Chunker chunker = new Chunker(SIZE, OVERLAP);

    // ---------- Helpers ----------

    /**
     * {@code count} sentences of exactly 49 characters, separated by one space.
     */
    private static String fixedSentences(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> StringUtils.rightPad("Sentence number " + i + " covers", 48, 'z') + ".")
                .collect(Collectors.joining(" "));
    }

    private static String letters(int n) {
        return StringUtils.repeat('a', n);
    }

    /**
     * Rebuilds the original text by dropping the shared prefix of every chunk after the first.
     */
    private static String reconstruct(List<Chunk> chunks) {
        StringBuilder sb = new StringBuilder(chunks.get(0).text());
        for (int i = 1; i < chunks.size(); i++) {
            Chunk previous = chunks.get(i - 1);
            Chunk current = chunks.get(i);
            sb.append(current.text().substring(previous.endOffset() - current.startOffset()));
        }
        return sb.toString();
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Blank text yields no chunks, null text is rejected")
    void blankOrNull() {
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("doc", null));
        assertTrue(chunker.chunk("doc", "").isEmpty());
        assertTrue(chunker.chunk("doc", "   ").isEmpty());
    }

    @Test
    @DisplayName("Short text yields one chunk without page info")
    void shortText() {
        List<Chunk> chunks = chunker.chunk("docA", "Hello world.");

        assertEquals(1, chunks.size());
        Chunk chunk = chunks.get(0);
        assertEquals("Hello world.", chunk.text());
        assertEquals("docA_00000", chunk.chunkId());
        assertEquals(0, chunk.ordinal());
        assertEquals(-1, chunk.pageStart());
        assertEquals(-1, chunk.pageEnd());
        assertEquals(3, chunk.tokenCount());
    }

    @Test
    @DisplayName("Nine thousand characters of short sentences give twenty chunks")
    void sentenceAlignedWindows() {
        String text = fixedSentences(180);
        assertEquals(8999, text.length());

        List<Chunk> chunks = chunker.chunk("doc", text);

        assertEquals(20, chunks.size());
        for (int i = 0; i < chunks.size() - 1; i++) {
            Chunk chunk = chunks.get(i);
            assertEquals(450 * i, chunk.startOffset());
            assertEquals(SIZE, chunk.text().length());
            assertTrue(chunk.text().startsWith("Sentence number "), "chunk " + i + " starts mid sentence");
        }
        assertEquals(8999, chunks.get(19).endOffset());
    }

    @Test
    @DisplayName("Consecutive chunks share exactly the configured overlap")
    void overlapIsExact() {
        List<Chunk> chunks = chunker.chunk("doc", fixedSentences(60));

        for (int i = 1; i < chunks.size(); i++) {
            Chunk previous = chunks.get(i - 1);
            Chunk current = chunks.get(i);
            assertEquals(OVERLAP, previous.endOffset() - current.startOffset());
            assertEquals(previous.text().substring(previous.text().length() - OVERLAP),
                    current.text().substring(0, OVERLAP));
        }
    }

    @Test
    @DisplayName("Chunks cover the whole text and are exact substrings")
    void coverage() {
        String text = fixedSentences(37) + "\n\n" + letters(1234) + " Tail sentence.";
        List<Chunk> chunks = chunker.chunk("doc", text);

        assertEquals(0, chunks.get(0).startOffset());
        assertEquals(text.length(), chunks.get(chunks.size() - 1).endOffset());
        for (Chunk chunk : chunks) {
            assertEquals(text.substring(chunk.startOffset(), chunk.endOffset()), chunk.text());
            assertTrue(chunk.text().length() <= SIZE);
        }
        assertEquals(text, reconstruct(chunks));
    }

    @Test
    @DisplayName("Text without boundaries is cut hard at the window size")
    void hardCut() {
        List<Chunk> chunks = chunker.chunk("doc", letters(1200));

        assertEquals(List.of(0, 450, 900), chunks.stream().map(Chunk::startOffset).toList());
        assertEquals(List.of(500, 950, 1200), chunks.stream().map(Chunk::endOffset).toList());
    }

    @Test
    @DisplayName("A paragraph break is a cut candidate")
    void paragraphBoundary() {
        String text = letters(300) + "\n\n" + letters(400);
        List<Chunk> chunks = chunker.chunk("doc", text);

        assertEquals(302, chunks.get(0).endOffset());
        assertEquals(252, chunks.get(1).startOffset());
    }

    @Test
    @DisplayName("Abbreviations do not end a sentence")
    void abbreviationIsNotABoundary() {
        Chunker small = new Chunker(40, 0);
        String text = "We met Dr. Watson at noon. Then we left.";

        List<Chunk> chunks = small.chunk("doc", text);

        assertEquals(1, chunks.size());
        List<Chunk> split = new Chunker(35, 0).chunk("doc", text);
        assertEquals("We met Dr. Watson at noon. ", split.get(0).text());
        assertEquals("Then we left.", split.get(1).text());
    }

    @Test
    @DisplayName("Chunking is deterministic")
    void deterministic() {
        String text = fixedSentences(90);
        assertEquals(chunker.chunk("doc", text), chunker.chunk("doc", text));
    }

    @Test
    @DisplayName("Page range comes from the first and last character")
    void pageMapping() {
        String text = letters(700);
        int[] pageMap = new int[text.length()];
        for (int i = 0; i < pageMap.length; i++) {
            pageMap[i] = i < 480 ? 1 : 2;
        }

        List<Chunk> chunks = chunker.chunk("doc", text, pageMap);

        assertEquals(1, chunks.get(0).pageStart());
        assertEquals(2, chunks.get(0).pageEnd());
        assertEquals(1, chunks.get(1).pageStart());
        assertEquals(2, chunks.get(1).pageEnd());
    }

    @Test
    @DisplayName("Invalid configuration and inputs are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(100, 100));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(100, -1));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(" ", "text"));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("doc", "text", new int[2]));
    }

    @Test
    @DisplayName("Chunk ids are zero padded")
    void chunkIds() {
        assertEquals("abc_00007", Chunker.chunkId("abc", 7));
        assertEquals("abc_12345", Chunker.chunkId("abc", 12345));
    }
}
