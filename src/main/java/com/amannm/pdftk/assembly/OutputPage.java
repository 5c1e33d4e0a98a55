package com.amannm.pdftk.assembly;

/**
 * One page of an output document: which input page to copy and how far to turn it.
 *
 * @param handle   handle of the source document
 * @param page     1-based page number in the source document
 * @param rotation clockwise rotation in degrees to add, 0 for none
 */
public record OutputPage(String handle, int page, int rotation) {

    @Override
    public String toString() {
        return rotation == 0 ? handle + page : handle + page + "@" + rotation;
    }
}
