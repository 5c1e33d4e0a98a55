package com.amannm.pdftk.document;

import java.io.Closeable;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDPage;

/**
 * A loaded input document as seen by the page operations: a page count and access to single pages.
 */
public interface DocumentSource extends Closeable {

    int pageCount();

    /**
     * @param index 1-based page number
     */
    PDPage getPage(int index) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
