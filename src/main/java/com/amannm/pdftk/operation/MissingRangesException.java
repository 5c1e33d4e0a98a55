package com.amannm.pdftk.operation;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when an operation that needs page ranges is run without any.
 */
public class MissingRangesException extends PdftkException {

    public MissingRangesException(String operation) {
        super(operation + " requires at least one page range");
    }
}
