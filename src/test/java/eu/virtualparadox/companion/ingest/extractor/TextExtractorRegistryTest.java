package eu.virtualparadox.companion.ingest.extractor;

import eu.virtualparadox.companion.error.UnsupportedFormatException;
import eu.virtualparadox.companion.ingest.cleaner.TextCleaner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextExtractorRegistryTest {

    private final TextCleaner cleaner = new TextCleaner();
    private final TextExtractorRegistry registry = new TextExtractorRegistry(
            List.of(new PdfTextExtractor(cleaner), new PlainTextExtractor(cleaner)));

    @Test
    void testExtensionIsMatchedCaseInsensitively() {
        assertThat(registry.requireSupported("Report.PDF")).isInstanceOf(PdfTextExtractor.class);
        assertThat(registry.requireSupported("notes.txt")).isInstanceOf(PlainTextExtractor.class);
    }

    @Test
    void testUnsupportedExtensionIsRejected() {
        assertThatThrownBy(() -> registry.requireSupported("slides.docx"))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessage(TextExtractorRegistry.UNSUPPORTED_MESSAGE);
        assertThatThrownBy(() -> registry.requireSupported("README"))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> registry.requireSupported(null))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void testExtensionOf() {
        assertThat(TextExtractorRegistry.extensionOf("a.b.TXT")).isEqualTo(".txt");
        assertThat(TextExtractorRegistry.extensionOf("noext")).isEmpty();
        assertThat(TextExtractorRegistry.extensionOf(null)).isEmpty();
    }
}
