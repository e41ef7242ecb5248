package eu.virtualparadox.companion.ingest.cleaner;

import org.springframework.stereotype.Component;

/**
 * Normalizes extracted text before chunking.
 * <ul>
 *   <li>zero-width, non-breaking and other format characters become spaces</li>
 *   <li>soft hyphens and control characters are dropped</li>
 *   <li>whitespace runs collapse to one space, or to a blank line when the run
 *       contained a paragraph break (two or more line breaks)</li>
 *   <li>leading and trailing whitespace is trimmed</li>
 * </ul>
 * Every kept or inserted character inherits the page of the source character it came from,
 * so the page map stays aligned with the output.
 */
@Component
public class TextCleaner {

    static final String PARAGRAPH_BREAK = "\n\n";

    private static final char SOFT_HYPHEN = '\u00AD';

    /**
     * Cleans text that carries no page information.
     *
     * @param input raw text
     * @return cleaned text
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return cleanTextWithPageMapping(input, new int[input.length()]).cleanText();
    }

    /**
     * Cleans text while maintaining the character-to-page mapping.
     *
     * @param input   raw text
     * @param pageMap page of every input character, same length as {@code input}
     * @return cleaned text with the adjusted page map
     * @throws IllegalArgumentException if the lengths differ
     */
    public CleaningResult cleanTextWithPageMapping(final String input, final int[] pageMap) {
        if (input == null || input.isEmpty()) {
            return new CleaningResult("", new int[0]);
        }
        if (pageMap == null || input.length() != pageMap.length) {
            throw new IllegalArgumentException("Text length must equal page map length");
        }

        final StringBuilder out = new StringBuilder(input.length());
        final int[] outPages = new int[input.length()];
        int outLen = 0;

        // pending whitespace run: -1 when none
        int pendingPage = -1;
        int pendingNewlines = 0;

        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);

            if (c == SOFT_HYPHEN) {
                continue;
            }

            if (c == '\r') {
                // \r\n counts once
                if (i + 1 < input.length() && input.charAt(i + 1) == '\n') {
                    continue;
                }
                if (pendingPage < 0) pendingPage = pageMap[i];
                pendingNewlines++;
                continue;
            }
            if (c == '\n') {
                if (pendingPage < 0) pendingPage = pageMap[i];
                pendingNewlines++;
                continue;
            }

            if (isSpaceLike(c)) {
                if (pendingPage < 0) pendingPage = pageMap[i];
                continue;
            }

            if (Character.getType(c) == Character.CONTROL) {
                continue;
            }

            if (pendingPage >= 0) {
                if (outLen > 0) {
                    final String separator = pendingNewlines >= 2 ? PARAGRAPH_BREAK : " ";
                    for (int s = 0; s < separator.length(); s++) {
                        out.append(separator.charAt(s));
                        outPages[outLen++] = pendingPage;
                    }
                }
                pendingPage = -1;
                pendingNewlines = 0;
            }

            out.append(c);
            outPages[outLen++] = pageMap[i];
        }

        final int[] trimmedPages = new int[outLen];
        System.arraycopy(outPages, 0, trimmedPages, 0, outLen);
        return new CleaningResult(out.toString(), trimmedPages);
    }

    private static boolean isSpaceLike(final char c) {
        return Character.isWhitespace(c)
                || Character.isSpaceChar(c)
                || Character.getType(c) == Character.FORMAT;
    }
}
