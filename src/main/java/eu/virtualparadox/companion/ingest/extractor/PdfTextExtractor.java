package eu.virtualparadox.companion.ingest.extractor;

import eu.virtualparadox.companion.ingest.cleaner.CleaningResult;
import eu.virtualparadox.companion.ingest.cleaner.TextCleaner;
import eu.virtualparadox.companion.ingest.model.ExtractedText;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;

/**
 * PDF extractor built on Apache PDFBox. Pages are concatenated in order and every character
 * is tagged with its 1-based page number, so chunks crossing a page break still know both pages.
 */
@Service
@RequiredArgsConstructor
public final class PdfTextExtractor implements TextExtractor {

    private final TextCleaner textCleaner;

    @Override
    public boolean supports(final String extension) {
        return ".pdf".equals(extension);
    }

    @Override
    public ExtractedText extract(final Path path) throws IOException {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder rawText = new StringBuilder(100_000);
            final PageMapBuilder pages = new PageMapBuilder();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                rawText.append(pageText);
                pages.add(page, pageText.length());
            }

            final CleaningResult cleaned = textCleaner.cleanTextWithPageMapping(rawText.toString(), pages.build());
            return new ExtractedText(cleaned.cleanText(), cleaned.pageMap(), pageCount);
        }
    }
}
