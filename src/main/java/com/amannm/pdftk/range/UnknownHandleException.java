package com.amannm.pdftk.range;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when a range token names a handle that no loaded document carries.
 */
public class UnknownHandleException extends PdftkException {

    private final String handle;

    /**
     * @param handle the handle as written in the range token
     */
    public UnknownHandleException(String handle) {
        super("Unknown handle: " + handle);
        this.handle = handle;
    }

    public String handle() {
        return handle;
    }
}
