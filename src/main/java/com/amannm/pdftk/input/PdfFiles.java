package com.amannm.pdftk.input;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;

/**
 * Checks run on input paths before any of them is opened.
 */
public final class PdfFiles {

    private PdfFiles() {
    }

    /**
     * @throws PdfFileNotFoundException when the file does not exist
     * @throws NotAPdfException         when the name does not end in {@code .pdf}, in any case
     */
    public static void validate(Path path) {
        if (!Files.exists(path)) {
            throw new PdfFileNotFoundException(path);
        }
        Path fileName = path.getFileName();
        if (fileName == null || !fileName.toString().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new NotAPdfException(path);
        }
    }

    public static void validateAll(Collection<Path> paths) {
        for (Path path : paths) {
            validate(path);
        }
    }
}
