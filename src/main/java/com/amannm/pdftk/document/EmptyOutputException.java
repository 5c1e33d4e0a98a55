package com.amannm.pdftk.document;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when the ranges of an operation select no page at all, e.g. {@code 1even}.
 */
public class EmptyOutputException extends PdftkException {

    public EmptyOutputException() {
        super("The given ranges select no pages");
    }
}
