package com.amannm.pdftk.document;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when a range or an output sequence asks for a page the document does not have.
 */
public class PageOutOfRangeException extends PdftkException {

    private final int page;
    private final int pageCount;

    public PageOutOfRangeException(String handle, int page, int pageCount) {
        super("Page " + page + " does not exist in document " + handle + " (" + pages(pageCount) + ")");
        this.page = page;
        this.pageCount = pageCount;
    }

    public PageOutOfRangeException(int page, int pageCount) {
        super("Page " + page + " does not exist (" + pages(pageCount) + ")");
        this.page = page;
        this.pageCount = pageCount;
    }

    private PageOutOfRangeException(String handle, String token, PageOutOfRangeException cause) {
        super("Page " + cause.page + " does not exist in document " + handle
            + " (" + pages(cause.pageCount) + ") in range '" + token + "'", cause);
        this.page = cause.page;
        this.pageCount = cause.pageCount;
    }

    /**
     * Returns a copy of this exception whose message names the document and the full range token.
     */
    public PageOutOfRangeException inDocument(String handle, String token) {
        return new PageOutOfRangeException(handle, token, this);
    }

    private static String pages(int pageCount) {
        return pageCount + (pageCount == 1 ? " page" : " pages");
    }
}
