package com.amannm.pdftk.input;

import com.amannm.pdftk.PdftkException;

/**
 * Raised for a {@code HANDLE=path} input whose handle is not made of letters or is used twice.
 */
public class InvalidHandleException extends PdftkException {

    public InvalidHandleException(String message) {
        super(message);
    }
}
