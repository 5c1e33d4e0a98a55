package com.amannm.pdftk.input;

import java.nio.file.Path;

import com.amannm.pdftk.PdftkException;

/**
 * Raised when an input file does not carry a {@code .pdf} extension.
 */
public class NotAPdfException extends PdftkException {

    public NotAPdfException(Path path) {
        super("File is not a PDF: " + path);
    }
}
