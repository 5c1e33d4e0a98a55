package com.amannm.pdftk.range;

import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * The {@code even} and {@code odd} filters of the range language.
 */
public enum PageQualifier {
    EVEN("even", page -> Math.floorMod(page, 2) == 0),
    ODD("odd", page -> Math.floorMod(page, 2) == 1);

    private final String keyword;
    private final IntPredicate filter;

    PageQualifier(String keyword, IntPredicate filter) {
        this.keyword = keyword;
        this.filter = filter;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Keeps the pages matching this qualifier, in their original order.
     */
    public List<Integer> apply(List<Integer> pages) {
        return pages.stream()
            .filter(page -> filter.test(page))
            .toList();
    }

    public static Optional<PageQualifier> suffixOf(String body) {
        for (PageQualifier qualifier : values()) {
            if (body.endsWith(qualifier.keyword)) {
                return Optional.of(qualifier);
            }
        }
        return Optional.empty();
    }
}
