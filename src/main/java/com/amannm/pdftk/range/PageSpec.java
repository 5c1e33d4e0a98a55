package com.amannm.pdftk.range;

import java.util.List;
import java.util.Objects;

/**
 * One parsed range token: the document it refers to, the pages it selects and the rotation to apply to them.
 *
 * @param handle   document handle, or {@code null} when the token relies on the default document
 * @param pages    1-based page numbers in output order, repeats and descending runs allowed
 * @param rotation clockwise rotation in degrees, one of -90, 0, 90, 180, 270
 */
public record PageSpec(String handle, List<Integer> pages, int rotation) {

    public PageSpec {
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
    }

    public boolean hasHandle() {
        return handle != null;
    }
}
