package com.amannm.pdftk.document;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;

/**
 * {@link DocumentSource} backed by a PDF file opened with PDFBox.
 */
public class PdfDocumentSource implements DocumentSource {

    private final PDDocument document;

    PdfDocumentSource(PDDocument document) {
        this.document = document;
    }

    public static PdfDocumentSource load(Path path) throws IOException {
        return new PdfDocumentSource(Loader.loadPDF(path.toFile()));
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public PDPage getPage(int index) {
        return document.getPage(index - 1);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
