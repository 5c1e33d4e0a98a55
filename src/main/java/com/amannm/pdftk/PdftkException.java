package com.amannm.pdftk;

/**
 * Base type for every failure reported by a page operation.
 * The message is written so it can be shown to the user as is.
 */
public abstract class PdftkException extends RuntimeException {

    protected PdftkException(String message) {
        super(message);
    }

    protected PdftkException(String message, Throwable cause) {
        super(message, cause);
    }
}
