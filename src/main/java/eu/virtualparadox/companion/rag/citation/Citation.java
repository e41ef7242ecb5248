package eu.virtualparadox.companion.rag.citation;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * One cited document: which pages and chunks of it were put into the prompt.
 */
public record Citation(String docId,
                       String filename,
                       List<PageInterval> pageIntervals,
                       List<String> chunkIds) {

    public String asString() {
        if (pageIntervals.isEmpty()) {
            return filename;
        }
        return filename + " p. " + StringUtils.join(pageIntervals.stream().map(PageInterval::asString).toList(), ", ");
    }
}
