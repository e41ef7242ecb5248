package eu.virtualparadox.companion.rag.citation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive, 1-based page range.
 */
public record PageInterval(int fromPage, int toPage) {

    public PageInterval {
        if (fromPage > toPage) {
            throw new IllegalArgumentException(
                    "Invalid interval: fromPage (" + fromPage + ") cannot be greater than toPage (" + toPage + ")");
        }
    }

    public String asString() {
        return fromPage == toPage ? String.valueOf(fromPage) : fromPage + "-" + toPage;
    }

    /**
     * Merges overlapping and touching intervals ({@code [1..3] + [4..6] = [1..6]}).
     *
     * @param intervals may be {@code null} or empty
     * @return sorted, disjoint, non-adjacent intervals; never {@code null}
     */
    public static List<PageInterval> merge(final List<PageInterval> intervals) {
        final List<PageInterval> merged = new ArrayList<>();
        if (intervals == null || intervals.isEmpty()) {
            return merged;
        }

        final List<PageInterval> sorted = new ArrayList<>(intervals);
        sorted.forEach(interval -> Objects.requireNonNull(interval, "interval must not be null"));
        sorted.sort(Comparator.comparingInt(PageInterval::fromPage).thenComparingInt(PageInterval::toPage));

        PageInterval current = sorted.get(0);
        for (final PageInterval next : sorted.subList(1, sorted.size())) {
            if (current.toPage() + 1 >= next.fromPage()) {
                current = new PageInterval(current.fromPage(), Math.max(current.toPage(), next.toPage()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }
}
