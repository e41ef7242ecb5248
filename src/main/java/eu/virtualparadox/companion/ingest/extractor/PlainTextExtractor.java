package eu.virtualparadox.companion.ingest.extractor;

import eu.virtualparadox.companion.ingest.cleaner.CleaningResult;
import eu.virtualparadox.companion.ingest.cleaner.TextCleaner;
import eu.virtualparadox.companion.ingest.model.ExtractedText;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;

/**
 * UTF-8 plain text. A form feed starts a new page; a file without form feeds is one page.
 * Malformed byte sequences are replaced rather than rejected.
 */
@Service
@RequiredArgsConstructor
public final class PlainTextExtractor implements TextExtractor {

    private static final char FORM_FEED = '\f';

    private final TextCleaner textCleaner;

    @Override
    public boolean supports(final String extension) {
        return ".txt".equals(extension);
    }

    @Override
    public ExtractedText extract(final Path path) throws IOException {
        final String raw = Normalizer.normalize(
                new String(Files.readAllBytes(path), StandardCharsets.UTF_8), Normalizer.Form.NFC);

        final PageMapBuilder pages = new PageMapBuilder();
        int page = 1;
        int runStart = 0;
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == FORM_FEED) {
                pages.add(page, i + 1 - runStart);
                runStart = i + 1;
                page++;
            }
        }
        pages.add(page, raw.length() - runStart);

        final CleaningResult cleaned = textCleaner.cleanTextWithPageMapping(raw, pages.build());
        return new ExtractedText(cleaned.cleanText(), cleaned.pageMap(), page);
    }
}
