package com.amannm.pdftk.range;

import java.util.List;
import java.util.Optional;

/**
 * Rotation suffixes of the range language and the clockwise rotation, in degrees, each one applies.
 * {@code right} and {@code down} are aliases of {@code east} and {@code south}.
 */
public enum RotationKeyword {
    NORTH("north", 0),
    EAST("east", 90),
    SOUTH("south", 180),
    WEST("west", 270),
    LEFT("left", -90),
    RIGHT("right", 90),
    DOWN("down", 180);

    // declaration order is the order suffixes are tried in
    private static final List<RotationKeyword> SUFFIX_ORDER = List.of(values());

    private final String keyword;
    private final int degrees;

    RotationKeyword(String keyword, int degrees) {
        this.keyword = keyword;
        this.degrees = degrees;
    }

    public String keyword() {
        return keyword;
    }

    public int degrees() {
        return degrees;
    }

    /**
     * Finds the keyword the given body ends with.
     *
     * @param body range token without its handle
     * @return the matching keyword, or empty when the body carries no rotation
     */
    public static Optional<RotationKeyword> suffixOf(String body) {
        for (RotationKeyword rotation : SUFFIX_ORDER) {
            if (body.endsWith(rotation.keyword)) {
                return Optional.of(rotation);
            }
        }
        return Optional.empty();
    }
}
