package com.amannm.pdftk.input;

import java.nio.file.Path;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when an input file does not exist.
 */
public class PdfFileNotFoundException extends PdftkException {

    public PdfFileNotFoundException(Path path) {
        super("PDF file not found: " + path);
    }
}
