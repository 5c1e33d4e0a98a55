package com.amannm.pdftk.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amannm.pdftk.assembly.OutputPage;

/**
 * Materializes an output sequence into a new PDF file.
 * <p>
 * The whole sequence is checked against the page counts before the new document is built,
 * and the file is only saved once every page has been copied, so a failing operation leaves no output behind.
 */
public class PdfSequenceWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfSequenceWriter.class);

    /**
     * @param registry source documents, kept open until the file is saved
     * @param sequence pages to copy, in output order
     * @param output   file to create or overwrite
     * @return number of pages written
     */
    public int write(DocumentRegistry registry, List<OutputPage> sequence, Path output) throws IOException {
        if (sequence.isEmpty()) {
            throw new EmptyOutputException();
        }
        for (OutputPage page : sequence) {
            int pageCount = registry.pageCount(page.handle());
            if (page.page() < 1 || page.page() > pageCount) {
                throw new PageOutOfRangeException(page.handle(), page.page(), pageCount);
            }
        }

        try (PDDocument target = new PDDocument()) {
            for (OutputPage page : sequence) {
                PDPage source = registry.source(page.handle()).getPage(page.page());
                PDPage imported = target.importPage(source);
                if (page.rotation() != 0) {
                    // rotations add up with what the page already carries
                    imported.setRotation(Math.floorMod(imported.getRotation() + page.rotation(), 360));
                }
            }
            createParentDirectories(output);
            target.save(output.toFile());
        }
        log.info("Wrote {} pages to {}", sequence.size(), output);
        return sequence.size();
    }

    private static void createParentDirectories(Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
