package com.amannm.pdftk.range;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

import com.amannm.pdftk.document.PageOutOfRangeException;

/**
 * Resolves the page part of a range token against a document's page count.
 * <p>
 * Both ends of a range are checked against the page count before the range is expanded.
 */
public final class PageResolver {

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern REVERSE = Pattern.compile("r\\d+");

    private PageResolver() {
    }

    /**
     * Resolves a page body such as {@code "3"}, {@code "5-end"} or {@code "r3-r1"}.
     * An empty body selects every page.
     *
     * @param body      page body with handle, qualifier and rotation already removed
     * @param pageCount number of pages in the referenced document
     * @return page numbers in the order the body lists them
     * @throws InvalidPageTokenException when a page reference cannot be read
     * @throws PageOutOfRangeException   when a reference names a page outside {@code [1, pageCount]}
     */
    public static List<Integer> resolve(String body, int pageCount) {
        if (body.isEmpty()) {
            return allPages(pageCount);
        }
        int dash = body.indexOf('-');
        if (dash < 0) {
            return List.of(existingPage(resolvePage(body, pageCount), pageCount));
        }
        int start = resolvePage(body.substring(0, dash), pageCount);
        int end = resolvePage(body.substring(dash + 1), pageCount);
        return range(existingPage(start, pageCount), existingPage(end, pageCount));
    }

    /**
     * Resolves a single page reference: {@code end} is the last page, {@code rend} the first,
     * {@code r<N>} the N-th page counted from the end, digits the page itself.
     * The result is not checked against the page count.
     */
    public static int resolvePage(String reference, int pageCount) {
        if ("end".equals(reference)) {
            return pageCount;
        }
        if ("rend".equals(reference)) {
            return 1;
        }
        if (REVERSE.matcher(reference).matches()) {
            int offset = parseNumber(reference.substring(1), reference);
            if (offset < 1) {
                throw new InvalidPageTokenException(reference);
            }
            return pageCount - offset + 1;
        }
        if (NUMBER.matcher(reference).matches()) {
            return parseNumber(reference, reference);
        }
        throw new InvalidPageTokenException(reference);
    }

    /**
     * Inclusive range, descending when {@code start > end}.
     */
    public static List<Integer> range(int start, int end) {
        if (start <= end) {
            return IntStream.rangeClosed(start, end).boxed().toList();
        }
        return IntStream.rangeClosed(end, start)
            .map(page -> start + end - page)
            .boxed()
            .toList();
    }

    public static List<Integer> allPages(int pageCount) {
        return IntStream.rangeClosed(1, pageCount).boxed().toList();
    }

    private static int existingPage(int page, int pageCount) {
        if (page < 1 || page > pageCount) {
            throw new PageOutOfRangeException(page, pageCount);
        }
        return page;
    }

    private static int parseNumber(String digits, String reference) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InvalidPageTokenException(reference);
        }
    }
}
