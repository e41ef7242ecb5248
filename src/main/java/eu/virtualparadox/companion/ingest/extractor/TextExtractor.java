package eu.virtualparadox.companion.ingest.extractor;

import eu.virtualparadox.companion.ingest.model.ExtractedText;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a stored upload into cleaned text, one implementation per file format.
 */
public interface TextExtractor {

    /**
     * @param extension lower-case file extension including the dot, e.g. {@code .pdf}
     */
    boolean supports(String extension);

    ExtractedText extract(Path path) throws IOException;
}
