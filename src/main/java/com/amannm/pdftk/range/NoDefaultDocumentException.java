package com.amannm.pdftk.range;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when a range has no handle and the registry cannot pick a document for it,
 * i.e. zero or several documents are loaded and none was named as the default.
 */
public class NoDefaultDocumentException extends PdftkException {

    public NoDefaultDocumentException(int documentCount) {
        super("No default document: " + documentCount + " documents loaded, use a handle");
    }

    public NoDefaultDocumentException(String token, int documentCount) {
        super("Range '" + token + "' has no handle and there is no default document ("
            + documentCount + " documents loaded)");
    }
}
