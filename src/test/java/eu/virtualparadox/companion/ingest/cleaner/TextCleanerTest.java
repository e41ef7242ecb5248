package eu.virtualparadox.companion.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover newline handling, control chars, non-breaking spaces,
 * zero-width spaces, soft hyphens and page map alignment.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        String input = "Dragons are dangerous creatures.";
        assertThat(cleaner.cleanText(input)).isEqualTo("Dragons are dangerous creatures.");
    }

    @Test
    void testSingleLineBreakBecomesSpace() {
        assertThat(cleaner.cleanText("volcanic\neruptions")).isEqualTo("volcanic eruptions");
    }

    @Test
    void testBlankLineIsKeptAsParagraphBreak() {
        assertThat(cleaner.cleanText("line1\r\n\r\nline2")).isEqualTo("line1\n\nline2");
        assertThat(cleaner.cleanText("line1\n  \n\n\tline2")).isEqualTo("line1\n\nline2");
    }

    @Test
    void testCarriageReturnLineFeedCountsOnce() {
        assertThat(cleaner.cleanText("line1\r\nline2")).isEqualTo("line1 line2");
    }

    @Test
    void testControlCharactersAreRemoved() {
        assertThat(cleaner.cleanText("valid\u0007text")).isEqualTo("validtext");
    }

    @Test
    void testZeroWidthAndNonBreakingSpacesBecomeSpaces() {
        assertThat(cleaner.cleanText("word1\u200Bword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Dword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\uFEFFword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testSoftHyphenIsRemoved() {
        assertThat(cleaner.cleanText("Tat\u00ADyana")).isEqualTo("Tatyana");
    }

    @Test
    void testWhitespaceRunsCollapseAndEdgesAreTrimmed() {
        assertThat(cleaner.cleanText("  a \t  b   ")).isEqualTo("a b");
        assertThat(cleaner.cleanText(" \n\n ")).isEmpty();
        assertThat(cleaner.cleanText(null)).isEmpty();
    }

    @Test
    void testPageMapFollowsOutput() {
        String input = "ab\n\ncd";
        int[] pages = {1, 1, 1, 2, 2, 2};

        CleaningResult result = cleaner.cleanTextWithPageMapping(input, pages);

        assertThat(result.cleanText()).isEqualTo("ab\n\ncd");
        assertThat(result.pageMap()).containsExactly(1, 1, 1, 1, 2, 2);
    }

    @Test
    void testPageMapDropsRemovedCharacters() {
        String input = "a\u00ADb \u0007c";
        int[] pages = {1, 1, 2, 2, 3, 3};

        CleaningResult result = cleaner.cleanTextWithPageMapping(input, pages);

        assertThat(result.cleanText()).isEqualTo("ab c");
        assertThat(result.pageMap()).containsExactly(1, 2, 2, 3);
    }

    @Test
    void testMismatchedPageMapIsRejected() {
        assertThatThrownBy(() -> cleaner.cleanTextWithPageMapping("abc", new int[2]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
