package com.amannm.pdftk.assembly;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when a range passed to shuffle does not name its document.
 */
public class ShuffleRequiresHandlesException extends PdftkException {

    public ShuffleRequiresHandlesException(int position) {
        super("shuffle requires a handle on every range (range " + position + " has none, e.g. use A1-10)");
    }
}
