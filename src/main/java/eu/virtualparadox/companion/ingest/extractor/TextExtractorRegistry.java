package eu.virtualparadox.companion.ingest.extractor;

import eu.virtualparadox.companion.error.UnsupportedFormatException;
import eu.virtualparadox.companion.ingest.model.ExtractedText;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks the {@link TextExtractor} matching a file name's extension.
 */
@Service
@RequiredArgsConstructor
public class TextExtractorRegistry {

    static final String UNSUPPORTED_MESSAGE = "Unsupported file format. Only PDF and TXT are supported.";

    private final List<TextExtractor> extractors;

    /**
     * @throws UnsupportedFormatException when no extractor handles the file name
     */
    public TextExtractor requireSupported(final String filename) {
        final String extension = extensionOf(filename);
        for (final TextExtractor extractor : extractors) {
            if (extractor.supports(extension)) {
                return extractor;
            }
        }
        throw new UnsupportedFormatException(UNSUPPORTED_MESSAGE);
    }

    public ExtractedText extract(final String filename, final Path path) throws IOException {
        return requireSupported(filename).extract(path);
    }

    /**
     * @return the extension including the dot (e.g. {@code .pdf}), lower case, or an empty string
     */
    public static String extensionOf(final String filename) {
        if (filename == null) {
            return "";
        }
        final int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return filename.substring(dot).trim().toLowerCase(Locale.ROOT);
    }
}
