package eu.virtualparadox.companion.ingest.extractor;

import java.util.Arrays;

/**
 * Growable per-character page map.
 */
final class PageMapBuilder {

    private int[] pages = new int[4096];
    private int size;

    void add(final int page, final int characters) {
        if (size + characters > pages.length) {
            pages = Arrays.copyOf(pages, Math.max(pages.length * 2, size + characters));
        }
        Arrays.fill(pages, size, size + characters, page);
        size += characters;
    }

    int[] build() {
        return Arrays.copyOf(pages, size);
    }
}
